package com.dailyresearch.pipeline.corpus;

import com.dailyresearch.pipeline.exception.CorpusUnavailableException;

import java.io.IOException;
import java.util.List;

/**
 * The persisted note corpus. Pipeline code never touches note files directly;
 * it goes through these operations only.
 *
 * <p>The store is assumed single-writer for the duration of a run.
 */
public interface CorpusStore {

    /**
     * Lists the notes under a folder, recursively, sorted by path. A folder that
     * does not exist yields an empty list.
     *
     * @throws CorpusUnavailableException when the corpus root itself cannot be reached
     */
    List<NoteHandle> listNotes(String pathPrefix);

    /** Reads a note's full text. */
    String read(NoteHandle note) throws IOException;

    /**
     * Replaces one line of a note, but only if that line still reads
     * {@code expected}. Line numbers are zero-based.
     *
     * @return true when the new line was written
     */
    boolean rewriteLine(NoteHandle note, int lineNumber, String expected, String replacement);

    /** Creates a new note; returns false if it already exists or could not be written. */
    boolean create(String path, String content);

    boolean exists(String path);

    /** Whether the corpus root can be read at all. */
    boolean isAvailable();
}
