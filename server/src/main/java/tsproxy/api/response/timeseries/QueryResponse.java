package tsproxy.api.response.timeseries;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.builder.ToStringBuilder;

public class QueryResponse {

    private List<QueryResult> queries = new ArrayList<>();

    public List<QueryResult> getQueries() {
        return queries;
    }

    public void setQueries(List<QueryResult> queries) {
        this.queries = queries;
    }

    public void addQuery(QueryResult query) {
        this.queries.add(query);
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("queries", this.queries);
        return tsb.toString();
    }
}
