package radarsat.composite.compositor;

import radarsat.composite.errors.IncompatibleLayerExtentException;
import radarsat.composite.errors.ProjectionUndefinedException;

/**
 * One input of the {@link Compositor}. Layers are read-only; they draw themselves onto a canvas the
 * compositor owns. Raster layers sample their pixels, vector layers rasterize their geometry at draw time.
 *
 * @since 0.3.0
 */
public interface CompositeLayer {

    String getName();

    LayerKind getKind();

    /**
     * Position in the stack; lower values are drawn first.
     */
    default int getZOrder() {
        return getKind().getZOrder();
    }

    /**
     * Alpha-composites this layer over the canvas.
     *
     * @throws IncompatibleLayerExtentException if the layer cannot be placed on the canvas grid
     * @throws ProjectionUndefinedException if vector geometry cannot be expressed in the canvas projection
     */
    void renderOnto(CompositeCanvas canvas) throws IncompatibleLayerExtentException, ProjectionUndefinedException;
}
