package radarsat.composite.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A named boundary polygon (e.g. a province), made of one or more closed rings of [x, y] vertices.
 * Multi-part boundaries such as island provinces are represented as several rings.
 */
public final class PolygonFeature {
    private final String name;
    private final List<double[][]> rings;

    public PolygonFeature(String name, List<double[][]> rings) {
        this.name = Objects.requireNonNull(name, "name");
        List<double[][]> copy = new ArrayList<>();
        for (double[][] ring : rings) {
            if (ring.length < 3) {
                throw new IllegalArgumentException("Ring of '" + name + "' has fewer than 3 vertices");
            }
            double[][] r = new double[ring.length][];
            for (int i = 0; i < ring.length; i++) {
                r[i] = new double[]{ring[i][0], ring[i][1]};
            }
            copy.add(r);
        }
        this.rings = List.copyOf(copy);
    }

    public String getName() { return name; }

    /**
     * @return the rings; callers must not modify the vertex arrays
     */
    public List<double[][]> getRings() { return rings; }
}
