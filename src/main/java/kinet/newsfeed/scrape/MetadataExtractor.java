package kinet.newsfeed.scrape;

import kinet.newsfeed.html.Dom;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class MetadataExtractor {
    private static final List<String> DATE_PROBES = List.of(
            "meta[property=article:published_time]",
            "meta[name=pubdate]", "meta[name=date]", "meta[name=publish-date]",
            "meta[itemprop=datePublished]",
            "time[datetime]",
            "[itemprop=datePublished]");

    private static final List<String> AUTHOR_PROBES = List.of(
            "meta[name=author]", "[rel=author]", "[itemprop=author]");

    static final int MAX_AUTHOR = 100;
    static final int MAX_DATE_TEXT = 50;

    private final DateParser dates;

    public MetadataExtractor(DateParser dates) {
        this.dates = dates;
    }

    public record Metadata(Instant published, String author) {}

    public Metadata extract(Document doc, List<String> dateSelectors, List<String> authorSelectors) {
        return new Metadata(publishedDate(doc, dateSelectors).orElse(null), author(doc, authorSelectors).orElse(null));
    }

    Optional<Instant> publishedDate(Document doc, List<String> profileSelectors) {
        List<String> probes = new ArrayList<>(DATE_PROBES);
        probes.addAll(profileSelectors);
        probes.add("[class~=(?i)date|time|published]");
        for (String css : probes) {
            Element e = Dom.firstSafe(doc, css);
            if (e == null) continue;
            String raw = firstNonBlank(e.attr("content"), e.attr("datetime"), Dom.text(e));
            if (raw.isEmpty()) continue;
            if (raw.length() > MAX_DATE_TEXT) raw = raw.substring(0, MAX_DATE_TEXT);
            Optional<Instant> parsed = dates.parse(raw);
            if (parsed.isPresent()) return parsed;
        }
        return Optional.empty();
    }

    Optional<String> author(Document doc, List<String> profileSelectors) {
        List<String> probes = new ArrayList<>(AUTHOR_PROBES);
        probes.addAll(profileSelectors);
        for (String css : probes) {
            Element e = Dom.firstSafe(doc, css);
            if (e == null) continue;
            String name = firstNonBlank(e.attr("content"), Dom.text(e));
            if (!name.isEmpty() && name.length() < MAX_AUTHOR) return Optional.of(name);
        }
        return Optional.empty();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v.strip();
        }
        return "";
    }
}
