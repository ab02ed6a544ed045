package kinet.newsfeed.profile;

public enum ApiKind {
    WORDPRESS, GRAPHQL, REST;

    public static ApiKind classify(String endpoint) {
        String u = endpoint.toLowerCase();
        if (u.contains("wp-json")) return WORDPRESS;
        if (u.contains("graphql")) return GRAPHQL;
        return REST;
    }
}
