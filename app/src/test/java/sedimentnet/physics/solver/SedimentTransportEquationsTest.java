package sedimentnet.physics.solver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sedimentnet.domain.exception.PhysicalInvariantViolationException;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario para SedimentTransportEquations.
 * Los valores de referencia están calculados a mano con las fórmulas cerradas.
 */
class SedimentTransportEquationsTest {

    // --------------------------------------------------------------------------
    // Test de la estructura de la clase
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("El constructor debe ser privado para prohibir la instanciación")
    void constructorIsPrivate() throws NoSuchMethodException {
        Constructor<SedimentTransportEquations> constructor = SedimentTransportEquations.class.getDeclaredConstructor();
        assertTrue(Modifier.isPrivate(constructor.getModifiers()), "El constructor debe ser privado.");
    }

    // --------------------------------------------------------------------------
    // Pendiente del cauce
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Pendiente: desnivel de 10 m en 10 m da pendiente unitaria")
    void recalculateChannelSlope_shouldReturnDropOverLength() {
        assertEquals(1.0, SedimentTransportEquations.recalculateChannelSlope(10, 0, 10), 1e-12);
    }

    @Test
    @DisplayName("Pendiente: un tramo plano recibe el umbral mínimo")
    void recalculateChannelSlope_shouldApplyFloorToFlatLink() {
        assertEquals(SedimentTransportEquations.SLOPE_THRESHOLD,
                SedimentTransportEquations.recalculateChannelSlope(0, 0, 10), 1e-15);
    }

    @Test
    @DisplayName("Pendiente: un tramo en contrapendiente viola el invariante")
    void recalculateChannelSlope_shouldRejectNegativeSlope() {
        assertThrows(PhysicalInvariantViolationException.class,
                () -> SedimentTransportEquations.recalculateChannelSlope(0, 10, 10));
    }

    // --------------------------------------------------------------------------
    // Espesor de aluvión
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Aluvión: reparte el volumen almacenado sobre la superficie de los tramos adyacentes")
    void calculateAlluviumDepth_shouldMatchReferenceValues() {
        assertEquals(10.0, SedimentTransportEquations.calculateAlluviumDepth(
                100, new double[]{0.5, 1}, new double[]{10, 10}, 1, 10, 0.2), 1e-12);
        assertEquals(3.0, SedimentTransportEquations.calculateAlluviumDepth(
                24, new double[]{0.1, 3}, new double[]{10, 10}, 1, 1, 0.5), 1e-12);
    }

    @Test
    @DisplayName("Aluvión: una porosidad mayor que 1 produce un espesor negativo y se rechaza")
    void calculateAlluviumDepth_shouldRejectNegativeDepth() {
        assertThrows(PhysicalInvariantViolationException.class, () -> SedimentTransportEquations.calculateAlluviumDepth(
                24, new double[]{0.1, 3}, new double[]{10, 10}, 1, 1, 2));
    }

    @Test
    @DisplayName("Aluvión: en una salida solo cuentan los tramos que aportan")
    void calculateAlluviumDepth_shouldIgnoreMissingDownstreamLinkAtOutlet() {
        double depth = SedimentTransportEquations.calculateAlluviumDepth(
                0.0, new double[]{15}, new double[]{100}, 0.0, 0.0, 0.3);
        assertEquals(0.0, depth);
    }

    // --------------------------------------------------------------------------
    // Capa activa y tensiones
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Wong (2007): espesor de capa activa para grava de 5 cm")
    void calculateActiveLayerThickness_shouldFollowWongApproximation() {
        double thickness = SedimentTransportEquations.calculateActiveLayerThickness(
                1000, 9.81, 0.0078, 2.0, 2650, 0.05);
        // τ* = 153.036 / 809.325 = 0.18909
        double expected = 0.515 * 0.05 * Math.pow(3.09 * (153.036 / 809.325 - 0.0549), 0.56);
        assertEquals(expected, thickness, 1e-9);
        assertEquals(0.01573, thickness, 1e-4);
    }

    @Test
    @DisplayName("Wong (2007): bajo el umbral crítico el espesor no es finito")
    void calculateActiveLayerThickness_shouldBeNaNBelowCriticalShields() {
        double thickness = SedimentTransportEquations.calculateActiveLayerThickness(
                1000, 9.81, 1e-4, 0.1, 2650, 0.05);
        assertTrue(Double.isNaN(thickness));
    }

    @Test
    @DisplayName("Wong (2007): un tramo sin granos (medias NaN) da NaN")
    void calculateActiveLayerThickness_shouldBeNaNWithoutGrains() {
        assertTrue(Double.isNaN(SedimentTransportEquations.calculateActiveLayerThickness(
                1000, 9.81, 0.01, 1.0, Double.NaN, Double.NaN)));
    }

    @Test
    @DisplayName("Tensión de Shields de referencia: valores de Wilcock & Crowe")
    void calculateReferenceShearStress_shouldMatchReferenceValues() {
        assertEquals(0.036, SedimentTransportEquations.calculateReferenceShearStress(1, 1, 1, 1, 0), 0.01);
        assertEquals(33.957, SedimentTransportEquations.calculateReferenceShearStress(1000, 1.65, 9.8, 0.1, 0.9), 0.01);
    }

    @Test
    @DisplayName("Tensión de Shields de referencia: un sedimento más ligero que el agua la vuelve negativa")
    void calculateReferenceShearStress_shouldRejectNegativeResult() {
        assertThrows(PhysicalInvariantViolationException.class,
                () -> SedimentTransportEquations.calculateReferenceShearStress(1000, -0.5, 9.81, 0.05, 0.0));
    }

    @Test
    @DisplayName("Ocultamiento: un grano del tamaño medio tiene b = 0.67 / (1 + e^0.5)")
    void calculateHidingExponent_shouldMatchFormulaAtMeanSize() {
        assertEquals(0.67 / (1 + Math.exp(0.5)), SedimentTransportEquations.calculateHidingExponent(0.05, 0.05), 1e-12);
    }

    // --------------------------------------------------------------------------
    // Tasa de transporte W*
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("W*: rama de bajo transporte por debajo de φ = 1.35")
    void calculateDimensionlessTransportRate_shouldUseLowBranch() {
        assertEquals(0.002, SedimentTransportEquations.calculateDimensionlessTransportRate(1.0), 1e-12);
        assertEquals(0.0, SedimentTransportEquations.calculateDimensionlessTransportRate(0.0));
    }

    @Test
    @DisplayName("W*: rama de alto transporte desde φ = 1.35")
    void calculateDimensionlessTransportRate_shouldUseHighBranch() {
        double expected = 14.0 * Math.pow(1.0 - 0.894 / 2.0, 4.5);
        assertEquals(expected, SedimentTransportEquations.calculateDimensionlessTransportRate(4.0), 1e-12);
    }

    @Test
    @DisplayName("W*: un φ negativo dispara la aserción de depuración")
    void calculateDimensionlessTransportRate_shouldAssertNonNegativePhi() {
        assertThrows(AssertionError.class, () -> SedimentTransportEquations.calculateDimensionlessTransportRate(-1.0));
    }

    // --------------------------------------------------------------------------
    // Abrasión
    // --------------------------------------------------------------------------

    @Test
    @DisplayName("Abrasión: volumen tras la ley exponencial de Sternberg")
    void calculateParcelVolumePostAbrasion_shouldDecayExponentially() {
        assertEquals(7.4081822068171785, SedimentTransportEquations.calculateParcelVolumePostAbrasion(10, 100, 0.003), 1e-12);
        assertEquals(9.3576229688401746e-13, SedimentTransportEquations.calculateParcelVolumePostAbrasion(10, 300, 0.1), 1e-24);
    }

    @Test
    @DisplayName("Abrasión: una tasa negativa haría crecer la parcela y se rechaza")
    void calculateParcelVolumePostAbrasion_shouldRejectGrowingVolume() {
        assertThrows(PhysicalInvariantViolationException.class,
                () -> SedimentTransportEquations.calculateParcelVolumePostAbrasion(10, 300, -3));
    }

    @Test
    @DisplayName("Abrasión: el diámetro escala con la raíz cúbica del cociente de volúmenes")
    void calculateGrainDiameterPostAbrasion_shouldScaleWithCubeRoot() {
        assertEquals(10.0, SedimentTransportEquations.calculateGrainDiameterPostAbrasion(10, 1, 1));
        assertEquals(7.937, SedimentTransportEquations.calculateGrainDiameterPostAbrasion(10, 2, 1), 1e-3);
    }
}
