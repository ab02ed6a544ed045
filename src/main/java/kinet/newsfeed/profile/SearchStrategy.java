package kinet.newsfeed.profile;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * How a site is searched. Patterns and endpoints may contain a {@code {query}} placeholder.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SearchStrategy.Api.class, name = "api"),
        @JsonSubTypes.Type(value = SearchStrategy.SearchUrl.class, name = "search_url"),
        @JsonSubTypes.Type(value = SearchStrategy.Homepage.class, name = "homepage")
})
public sealed interface SearchStrategy {

    record Api(String endpoint, ApiKind kind) implements SearchStrategy {}

    record SearchUrl(String pattern) implements SearchStrategy {}

    /** A fixed page (homepage or a listing such as /news) that ignores the query. */
    record Homepage(String url) implements SearchStrategy {}

    static String describe(SearchStrategy s) {
        if (s instanceof Api a) return "api/" + a.kind().name().toLowerCase() + " " + a.endpoint();
        if (s instanceof SearchUrl su) return "search " + su.pattern();
        return "homepage " + ((Homepage) s).url();
    }
}
