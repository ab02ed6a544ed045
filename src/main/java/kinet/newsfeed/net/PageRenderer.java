package kinet.newsfeed.net;

/**
 * Produces the final DOM of a page after client-side scripts ran and lazy-loaded
 * content was triggered by scrolling.
 */
public interface PageRenderer {
    String render(String url, RenderOptions options) throws FetchException;
}
