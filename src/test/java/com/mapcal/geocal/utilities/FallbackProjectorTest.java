package com.mapcal.geocal.utilities;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.mapcal.geocal.model.GeoBounds;
import com.mapcal.geocal.model.GeoPoint;
import com.mapcal.geocal.model.Projection;
import com.mapcal.geocal.model.ProjectionMethod;
import com.mapcal.geocal.model.RenderPoint;
import com.mapcal.geocal.service.MapProvider;
import com.mapcal.geocal.service.RenderHost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

/**
 * Unit tests for FallbackProjector. Provider methods not stubbed in a test return
 * {@code Optional.empty()}, i.e. "unavailable".
 */
@ExtendWith(MockitoExtension.class)
class FallbackProjectorTest {

    @Mock MapProvider mapProvider;
    @Mock RenderHost renderHost;

    private FallbackProjector projector;

    @BeforeEach
    void setUp() {
        lenient().when(renderHost.viewportWidth()).thenReturn(1000.0);
        lenient().when(renderHost.viewportHeight()).thenReturn(1000.0);
        projector = new FallbackProjector(mapProvider, renderHost);
    }

    // ==================== Provider Path ====================

    @Test
    @DisplayName("Provider's own conversion is used when it answers")
    void testProviderConversionPreferred() {
        when(mapProvider.renderToGeographic(new RenderPoint(1, 2))).thenReturn(Optional.of(new GeoPoint(3, 4)));

        Projection<GeoPoint> result = projector.toGeographic(new RenderPoint(1, 2));

        assertEquals(ProjectionMethod.PROVIDER, result.method());
        assertEquals(new GeoPoint(3, 4), result.point());
        verify(mapProvider, never()).viewportBounds();
        verifyNoInteractions(renderHost);
    }

    @Test
    @DisplayName("Provider's inverse conversion is used when it answers")
    void testProviderInversePreferred() {
        when(mapProvider.geographicToRender(any())).thenReturn(Optional.of(new RenderPoint(7, 8)));

        Projection<RenderPoint> result = projector.toRender(new GeoPoint(0.1, 0.2));

        assertEquals(ProjectionMethod.PROVIDER, result.method());
        assertEquals(new RenderPoint(7, 8), result.point());
    }

    // ==================== Linear Path ====================

    @Test
    @DisplayName("Viewport center maps to the center of bounds NE(1,1) SW(0,0)")
    void testLinearProjectionAtCenter() {
        when(mapProvider.viewportBounds()).thenReturn(Optional.of(GeoBounds.of(1, 1, 0, 0)));

        Projection<GeoPoint> result = projector.toGeographic(new RenderPoint(500, 500));

        assertEquals(ProjectionMethod.LINEAR_ESTIMATE, result.method());
        assertEquals(0.5, result.point().lat(), 1e-12);
        assertEquals(0.5, result.point().lon(), 1e-12);
    }

    @Test
    @DisplayName("Top-left of the viewport is the north-west corner (north up)")
    void testLinearProjectionNorthUp() {
        when(mapProvider.viewportBounds()).thenReturn(Optional.of(GeoBounds.of(1, 1, 0, 0)));

        GeoPoint topLeft = projector.toGeographic(new RenderPoint(0, 0)).point();
        GeoPoint bottomRight = projector.toGeographic(new RenderPoint(1000, 1000)).point();

        assertEquals(1.0, topLeft.lat(), 1e-12);
        assertEquals(0.0, topLeft.lon(), 1e-12);
        assertEquals(0.0, bottomRight.lat(), 1e-12);
        assertEquals(1.0, bottomRight.lon(), 1e-12);
    }

    @Test
    @DisplayName("Reported center takes precedence over the bounds midpoint")
    void testReportedCenterUsed() {
        when(mapProvider.viewportBounds()).thenReturn(Optional.of(GeoBounds.of(1, 1, 0, 0)));
        when(mapProvider.viewportCenter()).thenReturn(Optional.of(new GeoPoint(0.6, 0.4)));

        GeoPoint center = projector.toGeographic(new RenderPoint(500, 500)).point();

        assertEquals(new GeoPoint(0.6, 0.4), center);
    }

    @Test
    @DisplayName("Linear inverse maps the geographic center to the viewport center")
    void testLinearInverse() {
        when(mapProvider.viewportBounds()).thenReturn(Optional.of(GeoBounds.of(1, 1, 0, 0)));

        Projection<RenderPoint> center = projector.toRender(new GeoPoint(0.5, 0.5));
        RenderPoint corner = projector.toRender(new GeoPoint(1, 0)).point();

        assertEquals(ProjectionMethod.LINEAR_ESTIMATE, center.method());
        assertEquals(500.0, center.point().x(), 1e-9);
        assertEquals(500.0, center.point().y(), 1e-9);
        assertEquals(0.0, corner.x(), 1e-9);
        assertEquals(0.0, corner.y(), 1e-9);
    }

    // ==================== Degraded Path ====================

    @Test
    @DisplayName("No center and no bounds gives a degraded zero point")
    void testNothingAvailable() {
        Projection<GeoPoint> geo = projector.toGeographic(new RenderPoint(10, 10));
        Projection<RenderPoint> render = projector.toRender(new GeoPoint(10, 10));

        assertTrue(geo.isDegraded());
        assertEquals(GeoPoint.ORIGIN, geo.point());
        assertTrue(render.isDegraded());
        assertEquals(RenderPoint.ORIGIN, render.point());
    }

    @Test
    @DisplayName("Center without bounds returns the center, flagged degraded")
    void testCenterWithoutBounds() {
        when(mapProvider.viewportCenter()).thenReturn(Optional.of(new GeoPoint(48.2, 16.37)));

        Projection<GeoPoint> geo = projector.toGeographic(new RenderPoint(10, 900));
        Projection<RenderPoint> render = projector.toRender(new GeoPoint(48.3, 16.5));

        assertTrue(geo.isDegraded());
        assertEquals(new GeoPoint(48.2, 16.37), geo.point());
        assertTrue(render.isDegraded());
        assertEquals(new RenderPoint(500, 500), render.point());
    }

    @Test
    @DisplayName("Zero-size viewport cannot give degrees per pixel")
    void testZeroViewport() {
        when(renderHost.viewportWidth()).thenReturn(0.0);
        when(mapProvider.viewportBounds()).thenReturn(Optional.of(GeoBounds.of(1, 1, 0, 0)));

        Projection<GeoPoint> geo = projector.toGeographic(new RenderPoint(10, 10));

        assertTrue(geo.isDegraded());
        assertEquals(new GeoPoint(0.5, 0.5), geo.point());
    }

    @Test
    @DisplayName("Inverse with a zero viewport is degraded, not a linear estimate")
    void testZeroViewportInverse() {
        when(renderHost.viewportWidth()).thenReturn(0.0);
        when(renderHost.viewportHeight()).thenReturn(0.0);
        when(mapProvider.viewportBounds()).thenReturn(Optional.of(GeoBounds.of(1, 1, 0, 0)));

        Projection<RenderPoint> render = projector.toRender(new GeoPoint(0.25, 0.75));

        assertTrue(render.isDegraded());
        assertEquals(new RenderPoint(0, 0), render.point());
    }

    @Test
    @DisplayName("Inverse with a negative viewport is degraded")
    void testNegativeViewportInverse() {
        when(renderHost.viewportWidth()).thenReturn(-1000.0);
        when(renderHost.viewportHeight()).thenReturn(-1000.0);
        when(mapProvider.viewportBounds()).thenReturn(Optional.of(GeoBounds.of(1, 1, 0, 0)));

        Projection<RenderPoint> render = projector.toRender(new GeoPoint(0.25, 0.75));
        Projection<GeoPoint> geo = projector.toGeographic(new RenderPoint(10, 10));

        assertEquals(ProjectionMethod.DEGRADED, render.method());
        assertEquals(ProjectionMethod.DEGRADED, geo.method());
    }

    @Test
    @DisplayName("Zero-span bounds cannot give pixels per degree")
    void testZeroSpanBounds() {
        when(mapProvider.viewportBounds()).thenReturn(Optional.of(GeoBounds.of(1, 1, 1, 0)));

        Projection<RenderPoint> render = projector.toRender(new GeoPoint(1, 0.2));

        assertTrue(render.isDegraded());
        assertEquals(new RenderPoint(500, 500), render.point());
    }
}
