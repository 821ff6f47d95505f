package de.anton.spectro.processor.spectro_processor.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One physical signal trace (x, y and auxiliary arrays) together with the corrections that can be
 * applied to it. Every correction overwrites {@code y} (and sometimes {@code x} or {@code yErr}),
 * keeps a copy of its result as a named {@link Trace} snapshot and appends a description of what
 * it did to the channel's correction log, which it also returns.
 * <p>
 * Corrections are order dependent: each one consumes the output of the previous step.
 */
public class Channel {

    private static final Logger logger = LoggerFactory.getLogger(Channel.class);

    private final String name;
    private double[] x;
    private double[] y;
    private double[] yErr;
    private final double[] concentrations;
    private final double[] darkSignal;
    private final double[] qcSignal;
    private final double[] shotSize;

    private final Map<Trace, double[]> snapshots = new EnumMap<>(Trace.class);
    private final List<String> correctionLog = new ArrayList<>();

    /**
     * Creates a channel with neutral defaults for everything but x and y.
     */
    public Channel(String name, double[] x, double[] y) {
        this(name, x, y, null, null, null, null, null);
    }

    /**
     * Creates a channel. Optional arrays may be null and are then replaced by values that leave the
     * signal unchanged: error 0, concentration 1, dark signal 0, QC signal 1, shot size 0.
     *
     * @throws IllegalArgumentException if x or y is empty or any array differs in length from y.
     */
    public Channel(String name, double[] x, double[] y, double[] yErr, double[] concentrations,
                   double[] darkSignal, double[] qcSignal, double[] shotSize) {
        this.name = Objects.requireNonNull(name, "Channel name cannot be null.");
        if (x == null || y == null || x.length == 0 || y.length == 0) {
            throw new IllegalArgumentException("No x or y values recorded for channel " + name);
        }
        int n = y.length;
        this.x = checkedCopy("x", x, n);
        this.y = y.clone();
        this.yErr = yErr == null ? filled(n, 0.0) : checkedCopy("error", yErr, n);
        this.concentrations = concentrations == null ? filled(n, 1.0) : checkedCopy("concentration", concentrations, n);
        this.darkSignal = darkSignal == null ? filled(n, 0.0) : checkedCopy("dark signal", darkSignal, n);
        this.qcSignal = qcSignal == null ? filled(n, 1.0) : checkedCopy("QC signal", qcSignal, n);
        this.shotSize = shotSize == null ? filled(n, 0.0) : checkedCopy("shot size", shotSize, n);

        snapshots.put(Trace.RAW_X, this.x.clone());
        snapshots.put(Trace.RAW_SIGNAL, this.y.clone());
        snapshots.put(Trace.RAW_ERROR, this.yErr.clone());
    }

    private double[] checkedCopy(String what, double[] values, int expectedLength) {
        if (values.length != expectedLength) {
            throw new IllegalArgumentException("Channel " + name + ": " + what + " has " + values.length
                    + " values, signal has " + expectedLength);
        }
        return values.clone();
    }

    private static double[] filled(int n, double value) {
        double[] values = new double[n];
        Arrays.fill(values, value);
        return values;
    }

    private static double divide(double numerator, double denominator, String what) {
        if (denominator == 0.0) {
            throw new ArithmeticException("Division by zero in " + what);
        }
        return numerator / denominator;
    }

    private String record(String entry) {
        if (!entry.isEmpty()) {
            correctionLog.add(entry);
        }
        return entry;
    }

    // --- Corrections ---

    /**
     * Corrects for photomultiplier dark current and quantum counter drift:
     * {@code y = (y - dark) / qc}. Creates {@link Trace#QC_CORRECTED}.
     */
    public String correctDarkQc() {
        double[] corrected = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            corrected[i] = divide(y[i] - darkSignal[i], qcSignal[i], "QC correction of channel " + name + ", row " + i);
        }
        y = corrected;
        snapshots.put(Trace.QC_CORRECTED, corrected.clone());
        logger.debug("Channel {}: corrected with QC and dark signals", name);
        return record("Corrected with QC and dark signals\n");
    }

    /**
     * Removes buffer and titrant blank contributions:
     * {@code y = y - buffer - (titrant - buffer) * (1 - concentration)}.
     * Creates {@link Trace#BLANK_CORRECTED}.
     */
    public String correctTitrantBlanks(double bufferBlank, double titrantBlank) {
        double titrantSignal = titrantBlank - bufferBlank;
        double[] corrected = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            corrected[i] = y[i] - bufferBlank - titrantSignal * (1 - concentrations[i]);
        }
        y = corrected;
        snapshots.put(Trace.BLANK_CORRECTED, corrected.clone());
        logger.debug("Channel {}: blank corrected (buffer={}, titrant={})", name, bufferBlank, titrantBlank);
        return record("Titrant Blank Correction:\n"
                + String.format(Locale.ROOT, "    Buffer blank: %.3f\n", bufferBlank)
                + String.format(Locale.ROOT, "    Titrant blank: %.3f\n", titrantBlank));
    }

    /**
     * Corrects for dilution: {@code y = y / concentration}. Creates {@link Trace#DILUTION_CORRECTED}.
     */
    public String correctDilution() {
        double[] corrected = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            corrected[i] = divide(y[i], concentrations[i], "dilution correction of channel " + name + ", row " + i);
        }
        y = corrected;
        snapshots.put(Trace.DILUTION_CORRECTED, corrected.clone());
        logger.debug("Channel {}: corrected for dilution", name);
        return record("Corrected signal for dilution\n");
    }

    /**
     * Recomputes the titrant concentration axis from the injected volumes:
     * {@code t[0] = C0; t[i] = t[i-1]*(V - s[i]/1000)/V + (s[i]/1000)*Ct/V}.
     * <p>
     * Values not overridden (null) are taken from {@code instrumentValues}. Nothing happens if no
     * override is given or the overrides equal the instrument values; {@link Trace#DENATURANT_X}
     * then holds the unchanged x-axis.
     *
     * @param instrumentValues Initial concentration (M), titrant concentration (M) and cell volume (mL)
     *                         as reported by the instrument; entries may be null.
     * @param initConc         Override for the initial titrant concentration, or null.
     * @param titrantConc      Override for the titrant stock concentration, or null.
     * @param cellVolume       Override for the cell volume, or null.
     * @return The log entry, empty if nothing was changed.
     * @throws IllegalArgumentException if a value is neither overridden nor reported by the instrument.
     */
    public String correctDenaturant(List<Double> instrumentValues, Double initConc, Double titrantConc, Double cellVolume) {
        if (instrumentValues.size() != 3) {
            throw new IllegalArgumentException("Expected 3 instrument values, got " + instrumentValues.size());
        }
        List<Double> overrides = Arrays.asList(initConc, titrantConc, cellVolume);
        if (overrides.equals(instrumentValues) || overrides.stream().allMatch(Objects::isNull)) {
            snapshots.put(Trace.DENATURANT_X, x.clone());
            return "";
        }

        double[] used = new double[3];
        String[] labels = {"initial titrant concentration", "titrant concentration", "cell volume"};
        for (int k = 0; k < 3; k++) {
            Double value = overrides.get(k) != null ? overrides.get(k) : instrumentValues.get(k);
            if (value == null) {
                throw new IllegalArgumentException("No " + labels[k] + " given and none reported by the instrument.");
            }
            used[k] = value;
        }
        double c0 = used[0];
        double ct = used[1];
        double volume = used[2];

        double[] titrant = new double[shotSize.length];
        titrant[0] = c0;
        for (int i = 1; i < shotSize.length; i++) {
            double shot = shotSize[i] / 1000;
            titrant[i] = divide(titrant[i - 1] * (volume - shot), volume, "denaturant correction")
                    + divide(shot * ct, volume, "denaturant correction");
        }
        x = titrant;
        snapshots.put(Trace.DENATURANT_X, titrant.clone());
        logger.debug("Channel {}: titrant axis recomputed (C0={}, Ct={}, V={})", name, c0, ct, volume);

        return record("Denaturant Correction:\n"
                + String.format(Locale.ROOT, "  Initial concentration: %s --> %.3f\n", formatNullable(instrumentValues.get(0)), c0)
                + String.format(Locale.ROOT, "  Titrant concentration: %s --> %.3f\n", formatNullable(instrumentValues.get(1)), ct)
                + String.format(Locale.ROOT, "  Cell volume:           %s --> %.3f\n", formatNullable(instrumentValues.get(2)), volume));
    }

    private static String formatNullable(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.3f", value);
    }

    /**
     * Subtracts the raw signal of a blank measurement. Creates {@link Trace#BLANKED}.
     *
     * @param blank       The first channel of the blank file, built without corrections; null for no blank.
     * @param blankSource Description of the blank (its file name) for the log.
     * @throws FormatException if the blank was recorded on a different x-axis.
     */
    public String subtractBlank(Channel blank, String blankSource) throws FormatException {
        if (blank == null) {
            snapshots.put(Trace.BLANKED, y.clone());
            return record("No blank correction done!\n");
        }
        double[] blankX = blank.getTrace(Trace.RAW_X);
        if (!Arrays.equals(snapshots.get(Trace.RAW_X), blankX)) {
            throw new FormatException("Blank file and input file do not match! (" + blankSource + ": "
                    + blankX.length + " x values, channel " + name + ": " + x.length + ")");
        }
        double[] blankSignal = blank.getTrace(Trace.RAW_SIGNAL);
        double[] blanked = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            blanked[i] = y[i] - blankSignal[i];
        }
        y = blanked;
        snapshots.put(Trace.BLANKED, blanked.clone());
        logger.debug("Channel {}: blank {} subtracted", name, blankSource);
        return record("Removed blank (\"" + blankSource + "\")\n");
    }

    /**
     * Converts signal and error to mean molar ellipticity with
     * {@code k = 100 * molecularWeight / (pathLength * initialConc * numResidues)}.
     * Creates {@link Trace#MME} and {@link Trace#MME_ERROR}.
     */
    public String convertToMme(int numResidues, double molecularWeight, double initialConc, double pathLength) {
        double factor = divide(100.0 * molecularWeight, pathLength * initialConc * numResidues, "MME conversion of channel " + name);
        double[] mme = new double[y.length];
        double[] mmeErr = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            mme[i] = y[i] * factor;
            mmeErr[i] = yErr[i] * factor;
        }
        y = mme;
        yErr = mmeErr;
        snapshots.put(Trace.MME, mme.clone());
        snapshots.put(Trace.MME_ERROR, mmeErr.clone());
        logger.debug("Channel {}: converted to MME (factor {})", name, factor);

        return record("MME conversion:\n"
                + String.format(Locale.ROOT, "  Initial concentration (ug/mL): %8.3f\n", initialConc)
                + String.format(Locale.ROOT, "  Number of residues:            %8d\n", numResidues)
                + String.format(Locale.ROOT, "  Molecular weight (Da):         %8d\n", (long) molecularWeight)
                + String.format(Locale.ROOT, "  Path length (cm):              %8.3f\n", pathLength));
    }

    /**
     * Min-max normalizes the signal to [0, 1], optionally inverting it ({@code max - v}).
     * The error is propagated as {@code err * normalized / y}, using the signal before normalization,
     * so a signal crossing zero cannot be normalized.
     * Creates {@link Trace#NORMALIZED} and {@link Trace#NORMALIZED_ERROR}.
     *
     * @throws ArithmeticException if the signal is flat or contains a zero.
     */
    public String normalize(boolean invert) {
        double min = Arrays.stream(y).min().getAsDouble();
        double max = Arrays.stream(y).max().getAsDouble();
        double range = max - min;

        double[] normalized = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            normalized[i] = divide(y[i] - min, range, "normalization of channel " + name + " (flat signal)");
        }
        if (invert) {
            double normalizedMax = Arrays.stream(normalized).max().getAsDouble();
            for (int i = 0; i < normalized.length; i++) {
                normalized[i] = normalizedMax - normalized[i];
            }
        }

        double[] normalizedErr = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            normalizedErr[i] = divide(yErr[i] * normalized[i], y[i],
                    "error propagation of channel " + name + ", row " + i);
        }
        y = normalized;
        yErr = normalizedErr;
        snapshots.put(Trace.NORMALIZED, normalized.clone());
        snapshots.put(Trace.NORMALIZED_ERROR, normalizedErr.clone());
        logger.debug("Channel {}: normalized (inverted={})", name, invert);
        return record(invert ? "Normalized and inverted signal\n" : "Normalized signal\n");
    }

    // --- Accessors ---

    public String getName() {
        return name;
    }

    /**
     * @param trace The array to return.
     * @return A copy of the requested array.
     * @throws IllegalStateException if the trace is a snapshot of a correction that has not run.
     */
    public double[] getTrace(Trace trace) {
        switch (trace) {
            case X: return x.clone();
            case Y: return y.clone();
            case Y_ERROR: return yErr.clone();
            default:
                double[] snapshot = snapshots.get(trace);
                if (snapshot == null) {
                    throw new IllegalStateException("Trace " + trace + " is not available for channel " + name
                            + ": the producing correction was not applied.");
                }
                return snapshot.clone();
        }
    }

    public boolean hasTrace(Trace trace) {
        return trace == Trace.X || trace == Trace.Y || trace == Trace.Y_ERROR || snapshots.containsKey(trace);
    }

    public int size() {
        return y.length;
    }

    /** @return The log entries of all corrections applied so far, in order. */
    public List<String> getCorrectionLog() {
        return Collections.unmodifiableList(correctionLog);
    }

    @Override
    public String toString() {
        return "Channel[" + name + ", points=" + y.length + ", corrections=" + correctionLog.size() + "]";
    }
}
