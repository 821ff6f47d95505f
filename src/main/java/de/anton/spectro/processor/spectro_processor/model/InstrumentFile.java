package de.anton.spectro.processor.spectro_processor.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The lines of one instrument file together with an index of their tag column
 * (the first six characters, stripped) and the detected instrument/experiment pair.
 * Instances are created by {@link InstrumentFileReader} and never modified afterwards.
 */
public final class InstrumentFile {

    public static final int TAG_WIDTH = 6;

    private final Path path;
    private final List<String> lines;
    private final List<String> tags;                    // tags.get(i) is the tag column of lines.get(i)
    private final Map<String, Integer> firstTagPosition; // first line index per tag
    private final ExperimentDescriptor descriptor;

    InstrumentFile(Path path, List<String> lines, ExperimentDescriptor descriptor) {
        this.path = Objects.requireNonNull(path);
        this.lines = List.copyOf(lines);
        this.descriptor = Objects.requireNonNull(descriptor);
        this.tags = tagColumn(this.lines);
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < tags.size(); i++) {
            positions.putIfAbsent(tags.get(i), i);
        }
        this.firstTagPosition = Collections.unmodifiableMap(positions);
    }

    /** Computes the stripped tag column for a list of lines. */
    static List<String> tagColumn(List<String> lines) {
        String[] column = new String[lines.size()];
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            column[i] = line.substring(0, Math.min(TAG_WIDTH, line.length())).strip();
        }
        return List.of(column);
    }

    /** @return true if any line carries the given tag in its tag column. */
    public boolean containsTag(String tag) {
        return firstTagPosition.containsKey(tag);
    }

    /** @return Index of the first line carrying the tag, or -1. */
    public int indexOfTag(String tag) {
        return firstTagPosition.getOrDefault(tag, -1);
    }

    /**
     * Finds the first line starting with the given prefix. Needed for markers longer than the
     * tag column, such as {@code $CONFIG}.
     *
     * @return The line index, or -1.
     */
    public int indexOfLineStartingWith(String prefix) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).startsWith(prefix)) {
                return i;
            }
        }
        return -1;
    }

    public String line(int index) {
        return lines.get(index);
    }

    public int lineCount() {
        return lines.size();
    }

    /** @return An unmodifiable view of all lines. */
    public List<String> getLines() {
        return lines;
    }

    public Path getPath() {
        return path;
    }

    public ExperimentDescriptor getDescriptor() {
        return descriptor;
    }

    @Override
    public String toString() {
        return "InstrumentFile{" + path.getFileName() + ", " + descriptor + ", lines=" + lines.size() + '}';
    }
}
