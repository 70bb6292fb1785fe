package com.dailyresearch.pipeline.corpus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown notes with optional YAML frontmatter, as written by the daily note
 * writer and edited by hand in the vault.
 *
 * <p>Reading-list lines look like {@code - [ ] [Title](https://url) — summary #topic #keep}.
 */
public class MarkdownNoteFormat implements NoteFormat {
    /** URLs may carry one level of balanced parentheses, as in {@code /wiki/Foo_(bar)}. */
    private static final String URL_BODY = "(?:[^()\\s]|\\([^()\\s]*\\))+";
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\((https?://" + URL_BODY + ")\\)");
    private static final Pattern BARE_URL = Pattern.compile("https?://(?:[^()\\s\\]>\"']|\\([^()\\s]*\\))+");
    private static final Pattern HEADING = Pattern.compile("^#{1,4}\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern HASHTAG = Pattern.compile("(?<![\\w/#-])#([A-Za-z][\\w-]*)");
    private static final Pattern SUMMARY = Pattern.compile("^\\s*[—–-]\\s*(.+?)(?:\\s+#[\\w-]+)*\\s*$");

    @Override
    public List<NoteReference> extractReferences(String text) {
        List<NoteReference> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        String[] lines = text.split("\\r?\\n", -1);
        int bodyStart = frontmatterEnd(lines);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            List<int[]> linkSpans = new ArrayList<>();
            Matcher lm = LINK.matcher(line);
            while (lm.find()) {
                out.add(NoteReference.link(lm.group(1).trim(), stripTrailing(lm.group(2))));
                linkSpans.add(new int[]{lm.start(), lm.end()});
            }
            Matcher um = BARE_URL.matcher(line);
            while (um.find()) {
                if (insideAny(um.start(), linkSpans)) continue;
                out.add(NoteReference.bareUrl(stripTrailing(um.group())));
            }
            if (i >= bodyStart) {
                Matcher hm = HEADING.matcher(line);
                if (hm.matches()) {
                    out.add(NoteReference.heading(hm.group(1).trim()));
                }
            }
        }
        return out;
    }

    @Override
    public List<TaggedLine> parseTaggedLines(String text, Collection<String> tags) {
        List<TaggedLine> out = new ArrayList<>();
        if (text == null || text.isEmpty() || tags == null || tags.isEmpty()) return out;
        String[] lines = text.split("\\r?\\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.indexOf('#') < 0) continue;
            List<String> hashtags = hashtags(line);
            for (String tag : tags) {
                if (!hashtags.contains(tag)) continue;
                out.add(toTaggedLine(i, tag, line, hashtags));
            }
        }
        return out;
    }

    @Override
    public String replaceTag(String line, String from, String to) {
        Matcher m = tagPattern(from).matcher(line);
        if (!m.find()) return line;
        return line.substring(0, m.start()) + "#" + to + line.substring(m.end());
    }

    private TaggedLine toTaggedLine(int lineNumber, String tag, String line, List<String> hashtags) {
        Matcher lm = LINK.matcher(line);
        if (!lm.find()) {
            return new TaggedLine(lineNumber, tag, line, null, null, "", hashtags);
        }
        String summary = "";
        Matcher sm = SUMMARY.matcher(line.substring(lm.end()));
        if (sm.matches()) {
            summary = sm.group(1).trim();
        }
        return new TaggedLine(lineNumber, tag, line, lm.group(1).trim(), stripTrailing(lm.group(2)), summary, hashtags);
    }

    private static List<String> hashtags(String line) {
        List<String> out = new ArrayList<>();
        String withoutLinks = LINK.matcher(line).replaceAll(" ");
        Matcher m = HASHTAG.matcher(withoutLinks);
        while (m.find()) {
            out.add(m.group(1));
        }
        return out;
    }

    private static Pattern tagPattern(String tag) {
        return Pattern.compile("(?<![\\w/#-])#" + Pattern.quote(tag) + "(?![\\w-])");
    }

    /** Index of the first body line; 0 when there is no well-formed frontmatter. */
    private static int frontmatterEnd(String[] lines) {
        if (lines.length == 0 || !lines[0].trim().equals("---")) return 0;
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].trim().equals("---")) return i + 1;
        }
        return 0;
    }

    private static boolean insideAny(int pos, List<int[]> spans) {
        for (int[] s : spans) {
            if (pos >= s[0] && pos < s[1]) return true;
        }
        return false;
    }

    private static String stripTrailing(String url) {
        return url.replaceAll("[.,;:!?]+$", "");
    }
}
