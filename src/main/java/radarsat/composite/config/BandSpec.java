package radarsat.composite.config;

/**
 * A satellite band the pipeline extracts.
 *
 * @param index 1-based band index in the product
 * @param name short name used in file names and metadata, e.g. {@code wv_6.2um}
 * @param description human-readable description
 */
public record BandSpec(int index, String name, String description) {
}
