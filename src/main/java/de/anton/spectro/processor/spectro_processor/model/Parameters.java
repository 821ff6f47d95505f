package de.anton.spectro.processor.spectro_processor.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keys of the caller parameters and the catalog of their declarations.
 */
public final class Parameters {

    // CD instrument
    public static final String NUM_RESIDUES = "numResidues";
    public static final String MOLECULAR_WEIGHT = "molecularWeight";
    public static final String PROTEIN_CONC = "proteinConc";
    public static final String PATH_LENGTH = "pathLength";

    // ATF instrument
    public static final String SAMPLE = "sample";
    public static final String REFERENCE = "reference";
    public static final String QC_CORRECTION = "qcCorrection";

    // Titration
    public static final String SAMPLE_BUFFER_BLANK = "sampleBufferBlank";
    public static final String SAMPLE_TITRANT_BLANK = "sampleTitrantBlank";
    public static final String REFERENCE_BUFFER_BLANK = "referenceBufferBlank";
    public static final String REFERENCE_TITRANT_BLANK = "referenceTitrantBlank";
    public static final String INITIAL_TITRANT_CONC = "initialTitrantConc";
    public static final String TITRANT_STOCK_CONC = "titrantStockConc";
    public static final String CELL_VOLUME = "cellVolume";

    // Wavelength
    public static final String BLANK_FILE = "blankFile";

    // Setup header, no effect on the corrections
    public static final String USER = "user";
    public static final String COMMENTS = "comments";
    public static final String DENATURANT = "denaturant";
    public static final String BUFFER_REFRACTIVE_INDEX = "bufferRefractiveIndex";
    public static final String FINAL_REFRACTIVE_INDEX = "finalRefractiveIndex";

    private static final Map<String, ParameterSpec> CATALOG = new LinkedHashMap<>();

    static {
        register(ParameterSpec.required(NUM_RESIDUES, ValueType.INT, "number of residues in the protein"));
        register(ParameterSpec.required(MOLECULAR_WEIGHT, ValueType.FLOAT, "molecular weight of the protein (Da)"));
        register(ParameterSpec.required(PROTEIN_CONC, ValueType.FLOAT, "initial protein concentration (ug/mL)"));
        register(ParameterSpec.required(PATH_LENGTH, ValueType.FLOAT, "cuvette path length (cm)"));
        register(ParameterSpec.optional(SAMPLE, ValueType.BOOLEAN, "process the sample channel (ATF: sample or reference must be given)"));
        register(ParameterSpec.optional(REFERENCE, ValueType.BOOLEAN, "process the reference channel (ATF: sample or reference must be given)"));
        register(ParameterSpec.optional(QC_CORRECTION, ValueType.BOOLEAN, "correct for quantum counter and dark signal"));
        register(ParameterSpec.required(SAMPLE_BUFFER_BLANK, ValueType.FLOAT, "buffer blank of the sample channel (titration)"));
        register(ParameterSpec.required(SAMPLE_TITRANT_BLANK, ValueType.FLOAT, "titrant blank of the sample channel (titration)"));
        register(ParameterSpec.required(REFERENCE_BUFFER_BLANK, ValueType.FLOAT, "buffer blank of the reference channel (titration, only if the reference channel is processed)"));
        register(ParameterSpec.required(REFERENCE_TITRANT_BLANK, ValueType.FLOAT, "titrant blank of the reference channel (titration, only if the reference channel is processed)"));
        register(ParameterSpec.optional(INITIAL_TITRANT_CONC, ValueType.FLOAT, "initial titrant concentration in the cell (M)"));
        register(ParameterSpec.optional(TITRANT_STOCK_CONC, ValueType.FLOAT, "titrant stock concentration (M)"));
        register(ParameterSpec.optional(CELL_VOLUME, ValueType.FLOAT, "cell volume (mL)"));
        register(ParameterSpec.optional(BLANK_FILE, ValueType.STRING, "blank file to subtract from a wavelength scan"));
        register(ParameterSpec.optional(USER, ValueType.STRING, "name of the person running the experiment"));
        register(ParameterSpec.optional(COMMENTS, ValueType.STRING, "free text comments for the header"));
        register(ParameterSpec.optional(DENATURANT, ValueType.STRING, "denaturant used (gdmhcl or urea)"));
        register(ParameterSpec.optional(BUFFER_REFRACTIVE_INDEX, ValueType.FLOAT, "refractive index of the buffer"));
        register(ParameterSpec.optional(FINAL_REFRACTIVE_INDEX, ValueType.FLOAT, "refractive index of the final titration point"));
    }

    private static void register(ParameterSpec spec) {
        CATALOG.put(spec.key(), spec);
    }

    private Parameters() {
    }

    /** @return The declaration of a key, empty for unknown keys. */
    public static Optional<ParameterSpec> spec(String key) {
        return Optional.ofNullable(CATALOG.get(key));
    }

    /** @return All known parameters in declaration order. */
    public static List<ParameterSpec> catalog() {
        return List.copyOf(CATALOG.values());
    }
}
