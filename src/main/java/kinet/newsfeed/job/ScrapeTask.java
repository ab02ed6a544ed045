package kinet.newsfeed.job;

/**
 * One (site, filter[, category]) unit of a job.
 */
public record ScrapeTask(String url, String filter, String category) {

    /** Filter alone, or "filter category" when the task is scoped to a category. */
    public String effectiveQuery() {
        return category == null || category.isBlank() ? filter : filter + " " + category;
    }

    public String describe() {
        return category == null ? url + " with '" + filter + "'"
                : url + " with '" + filter + "' [" + category + "]";
    }
}
