package com.dailyresearch.pipeline.corpus;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Corpus-relative path of a note, always with forward slashes. */
public final class NoteHandle implements Comparable<NoteHandle> {
    private static final Pattern DATE = Pattern.compile("(\\d{4}-\\d{2}-\\d{2})");

    private final String path;

    public NoteHandle(String path) {
        this.path = path.replace('\\', '/');
    }

    public String getPath() {
        return path;
    }

    /** The YYYY-MM-DD embedded in the path (daily notes), or "". */
    public String dateInPath() {
        Matcher m = DATE.matcher(path);
        return m.find() ? m.group(1) : "";
    }

    @Override
    public int compareTo(NoteHandle o) {
        return path.compareTo(o.path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NoteHandle)) return false;
        return path.equals(((NoteHandle) o).path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path);
    }

    @Override
    public String toString() {
        return path;
    }
}
