package de.anton.spectro.processor.spectro_processor.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Opens an instrument file, indexes its tag column and identifies the instrument family
 * and experiment type.
 * <ul>
 *   <li>Instrument: {@code $PMTHV} present → ATF, else {@code $CDHV:} present → CD.</li>
 *   <li>Experiment: second line, text after its last colon.</li>
 * </ul>
 */
public class InstrumentFileReader {

    private static final Logger logger = LoggerFactory.getLogger(InstrumentFileReader.class);

    /**
     * Reads and identifies a file without any expectation about its content.
     *
     * @param path The instrument file.
     * @return The indexed file.
     * @throws FormatException If the file cannot be read or its instrument cannot be identified.
     */
    public InstrumentFile read(Path path) throws FormatException {
        return read(path, null);
    }

    /**
     * Reads and identifies a file, verifying it against the combination the caller committed to.
     *
     * @param path     The instrument file.
     * @param expected The expected instrument/experiment pair, or null to accept whatever is found.
     * @return The indexed file.
     * @throws FormatException If the file cannot be read, is not identifiable, or does not match {@code expected}.
     */
    public InstrumentFile read(Path path, ExperimentDescriptor expected) throws FormatException {
        Objects.requireNonNull(path, "Input file cannot be null.");
        logger.info("Reading instrument file: {}", path.toAbsolutePath());

        if (!Files.isRegularFile(path)) {
            throw new FormatException("\"" + path + "\" does not exist!");
        }

        List<String> lines;
        try {
            // Instrument software writes plain 8-bit text; Latin-1 never fails on stray bytes
            lines = Files.readAllLines(path, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            logger.error("IO error reading instrument file: {}", path.toAbsolutePath(), e);
            throw new FormatException("Could not read \"" + path + "\": " + e.getMessage(), e);
        }

        List<String> tags = InstrumentFile.tagColumn(lines);
        InstrumentFamily instrument = identifyInstrument(tags, path);
        String experimentType = identifyExperimentType(lines, path);
        ExperimentDescriptor found = new ExperimentDescriptor(instrument, experimentType);
        logger.debug("Identified {} as {}", path.getFileName(), found);

        if (expected != null) {
            if (expected.instrument() != found.instrument()) {
                throw new FormatException("Instrument type in \"" + path + "\" (" + found.instrument()
                        + ") does not match the selected processing profile (" + expected.instrument() + ")");
            }
            if (!expected.experimentType().equals(found.experimentType())) {
                throw new FormatException("Experiment type in \"" + path + "\" (" + found.experimentType()
                        + ") does not match the selected processing profile (" + expected.experimentType() + ")");
            }
        }

        return new InstrumentFile(path, lines, found);
    }

    private InstrumentFamily identifyInstrument(List<String> tags, Path path) throws FormatException {
        if (tags.contains(InstrumentFamily.ATF.getIdentifyingTag())) {
            return InstrumentFamily.ATF;
        }
        if (tags.contains(InstrumentFamily.CD.getIdentifyingTag())) {
            return InstrumentFamily.CD;
        }
        throw new FormatException("Instrument type in \"" + path + "\" is not recognized! Expected a "
                + InstrumentFamily.ATF.getIdentifyingTag() + " or " + InstrumentFamily.CD.getIdentifyingTag() + " tag.");
    }

    private String identifyExperimentType(List<String> lines, Path path) throws FormatException {
        if (lines.size() < 2) {
            throw new FormatException("\"" + path + "\" is too short to carry an experiment type line.");
        }
        String typeLine = lines.get(1);
        String type = typeLine.substring(typeLine.lastIndexOf(':') + 1).strip();
        if (type.isEmpty()) {
            throw new FormatException("Experiment type line of \"" + path + "\" is empty: '" + typeLine + "'");
        }
        return type;
    }
}
