package com.mapcal.geocal.service;

/**
 * The scene host that owns the render viewport.
 *
 * @since 0.1.0
 */
public interface RenderHost {

    /** @return current viewport width in pixels */
    double viewportWidth();

    /** @return current viewport height in pixels */
    double viewportHeight();
}
