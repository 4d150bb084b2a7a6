package com.metbull.sync.reconcile.extract;

import com.metbull.sync.reconcile.model.ExtractedEntry;
import com.metbull.sync.reconcile.model.PageExtraction;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls (catalog code, name) pairs out of a result page by matching the
 * {@code code=NNN} anchors of the listing. Works on the raw text so it keeps
 * working when the table markup around the anchors changes.
 */
@Component
public class RecordExtractor {
    private static final Logger log = LoggerFactory.getLogger(RecordExtractor.class);
    private static final Pattern ANCHOR_PATTERN = Pattern.compile("code=(\\d+)[^>]*>(.*?)</a>", Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]+>");
    private static final Pattern YEAR_CELL_PATTERN = Pattern.compile("<td>(\\d{4})</td>", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    public PageExtraction extract(String body) {
        if (body == null || body.isBlank()) {
            return PageExtraction.empty();
        }
        List<ExtractedEntry> entries = new ArrayList<>();
        Matcher matcher = ANCHOR_PATTERN.matcher(body);
        while (matcher.find()) {
            String name = cleanName(matcher.group(2));
            if (name.isEmpty()) {
                continue;
            }
            long code;
            try {
                code = Long.parseLong(matcher.group(1));
            } catch (NumberFormatException e) {
                log.debug("skipping anchor with oversized code {}", matcher.group(1));
                continue;
            }
            if (code <= 0) {
                continue;
            }
            entries.add(new ExtractedEntry(code, name));
        }
        return new PageExtraction(entries, extractYearTokens(body));
    }

    Set<Integer> extractYearTokens(String body) {
        Set<Integer> years = new LinkedHashSet<>();
        Matcher matcher = YEAR_CELL_PATTERN.matcher(body);
        while (matcher.find()) {
            years.add(Integer.parseInt(matcher.group(1)));
        }
        return years;
    }

    static String cleanName(String captured) {
        if (captured == null) {
            return "";
        }
        String withoutTags = TAG_PATTERN.matcher(captured).replaceAll("");
        String decoded = Parser.unescapeEntities(withoutTags, false).replace('\u00A0', ' ');
        return WHITESPACE_PATTERN.matcher(decoded).replaceAll(" ").trim();
    }
}
