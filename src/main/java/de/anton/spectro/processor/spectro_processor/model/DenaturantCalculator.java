package de.anton.spectro.processor.spectro_processor.model;

import java.util.List;
import java.util.Locale;

/**
 * Denaturant concentration (M) from the refractive index difference between a denaturant solution
 * and its buffer, using the Pace polynomials (Methods Enzymol. 131, 266-280, 1986).
 */
public final class DenaturantCalculator {

    /** Denaturants with a known polynomial and the names accepted for them. */
    public enum Denaturant {
        GDMHCL(List.of("gdn", "gdnhcl", "gdm", "gdmhcl", "g"), 57.147, 38.68, -91.60),
        UREA(List.of("urea", "u"), 117.66, 29.753, 185.56);

        private final List<String> synonyms;
        private final double a1;
        private final double a2;
        private final double a3;

        Denaturant(List<String> synonyms, double a1, double a2, double a3) {
            this.synonyms = synonyms;
            this.a1 = a1;
            this.a2 = a2;
            this.a3 = a3;
        }

        public double concentration(double deltaN) {
            return a1 * deltaN + a2 * deltaN * deltaN + a3 * deltaN * deltaN * deltaN;
        }

        public List<String> getSynonyms() {
            return synonyms;
        }
    }

    private DenaturantCalculator() {
    }

    /**
     * @param name Case-insensitive denaturant name, e.g. {@code GdmHCl} or {@code urea}.
     * @throws ConfigurationException if the name is not recognized.
     */
    public static Denaturant denaturantFor(String name) throws ConfigurationException {
        String key = name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
        for (Denaturant denaturant : Denaturant.values()) {
            if (denaturant.synonyms.contains(key)) {
                return denaturant;
            }
        }
        throw new ConfigurationException("Denaturant \"" + name + "\" not recognized!", List.of(Parameters.DENATURANT));
    }

    /**
     * @param denaturant      Denaturant name, see {@link #denaturantFor(String)}.
     * @param bufferIndex     Refractive index of the buffer (background).
     * @param sampleIndex     Refractive index of the denaturant solution.
     * @return The molar denaturant concentration.
     * @throws ConfigurationException if the denaturant is not recognized.
     */
    public static double concentration(String denaturant, double bufferIndex, double sampleIndex) throws ConfigurationException {
        return denaturantFor(denaturant).concentration(sampleIndex - bufferIndex);
    }
}
