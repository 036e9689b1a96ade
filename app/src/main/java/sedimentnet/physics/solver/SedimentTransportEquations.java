package sedimentnet.physics.solver;

import lombok.extern.slf4j.Slf4j;
import sedimentnet.domain.exception.PhysicalInvariantViolationException;

/**
 * Relaciones cerradas del transporte de sedimentos por parcelas.
 * <p>
 * Todas las funciones son puras y thread safe. Las que protegen un invariante físico
 * lanzan {@link PhysicalInvariantViolationException} en el punto de detección.
 */
@Slf4j
public final class SedimentTransportEquations {

    /** Pendiente mínima del cauce, evita divisiones por cero aguas abajo. */
    public static final double SLOPE_THRESHOLD = 1e-4;

    /** Espesor de capa activa cuando ningún tramo produce un valor finito [m]. */
    public static final double FALLBACK_ACTIVE_LAYER_THICKNESS = 0.03116362;

    /** Diámetro por debajo del cual un grano se considera arena [m]. */
    public static final double SAND_GRAIN_DIAMETER = 0.002;

    // Wong et al. (2007)
    private static final double WONG_COEFFICIENT = 0.515;
    private static final double WONG_SHIELDS_SCALE = 3.09;
    private static final double WONG_CRITICAL_SHIELDS = 0.0549;
    private static final double WONG_EXPONENT = 0.56;

    // Wilcock & Crowe (2003)
    private static final double PHI_TRANSITION = 1.35;
    private static final double LOW_TRANSPORT_COEFFICIENT = 0.002;
    private static final double LOW_TRANSPORT_EXPONENT = 7.5;
    private static final double HIGH_TRANSPORT_COEFFICIENT = 14.0;
    private static final double HIGH_TRANSPORT_OFFSET = 0.894;
    private static final double HIGH_TRANSPORT_EXPONENT = 4.5;

    /**
     * Prohibido construir esta clase utilidad
     */
    private SedimentTransportEquations() {
    }

    /**
     * Recalcula la pendiente de un tramo a partir de las cotas de sus extremos.
     *
     * @param upstreamElevation   Cota del nodo aguas arriba [m].
     * @param downstreamElevation Cota del nodo aguas abajo [m].
     * @param linkLength          Longitud del tramo [m].
     * @return Pendiente (m/m), nunca inferior a {@link #SLOPE_THRESHOLD}.
     * @throws PhysicalInvariantViolationException si la pendiente es negativa.
     */
    public static double recalculateChannelSlope(double upstreamElevation, double downstreamElevation, double linkLength) {
        double slope = (upstreamElevation - downstreamElevation) / linkLength;
        if (slope < 0.0) {
            throw new PhysicalInvariantViolationException(String.format(
                    "Pendiente de cauce negativa: (%.4f - %.4f) / %.2f = %.6f", upstreamElevation, downstreamElevation, linkLength, slope));
        }
        return Math.max(slope, SLOPE_THRESHOLD);
    }

    /**
     * Espesor de aluvión en un nodo a partir del volumen almacenado en su tramo aguas abajo,
     * repartido sobre la superficie de los tramos adyacentes.
     *
     * @param storedVolume           Volumen en la capa de almacenamiento del tramo aguas abajo [m³].
     * @param upstreamWidths         Anchos de los tramos que aportan al nodo [m].
     * @param upstreamLengths        Longitudes de los tramos que aportan al nodo [m].
     * @param downstreamWidth        Ancho del tramo aguas abajo (0 en una salida) [m].
     * @param downstreamLength       Longitud del tramo aguas abajo (0 en una salida) [m].
     * @param porosity               Porosidad del lecho.
     * @return Espesor de aluvión [m].
     * @throws PhysicalInvariantViolationException si el espesor resultante es negativo.
     */
    public static double calculateAlluviumDepth(double storedVolume,
                                                double[] upstreamWidths,
                                                double[] upstreamLengths,
                                                double downstreamWidth,
                                                double downstreamLength,
                                                double porosity) {
        double contributingArea = downstreamWidth * downstreamLength;
        for (int i = 0; i < upstreamWidths.length; i++) {
            contributingArea += upstreamWidths[i] * upstreamLengths[i];
        }
        double depth = 2.0 * storedVolume / contributingArea / (1.0 - porosity);
        if (depth < 0.0) {
            throw new PhysicalInvariantViolationException("Espesor de aluvión negativo: " + depth);
        }
        return depth;
    }

    /**
     * Espesor de la capa activa según la aproximación de Wong et al. (2007).
     *
     * @return Espesor [m]. NaN si la tensión adimensional no supera el umbral crítico o
     * si no hay granos en el tramo (diámetro medio NaN).
     */
    public static double calculateActiveLayerThickness(double fluidDensity,
                                                       double gravity,
                                                       double slope,
                                                       double flowDepth,
                                                       double meanSedimentDensity,
                                                       double meanDiameter) {
        double tau = fluidDensity * gravity * slope * flowDepth;
        double taustar = tau / ((meanSedimentDensity - fluidDensity) * gravity * meanDiameter);
        // Math.pow de una base negativa con exponente fraccionario devuelve NaN.
        return WONG_COEFFICIENT * meanDiameter * Math.pow(WONG_SHIELDS_SCALE * (taustar - WONG_CRITICAL_SHIELDS), WONG_EXPONENT);
    }

    /**
     * Tensión de Shields de referencia dependiente de la fracción de arena de la superficie
     * del lecho (Wilcock &amp; Crowe, 2003).
     *
     * @param fluidDensity          Densidad del fluido [kg/m³].
     * @param submergedSpecificGravity R = (ρs - ρ) / ρ.
     * @param gravity               Aceleración de la gravedad [m/s²].
     * @param meanActiveDiameter    Diámetro medio de la capa activa [m].
     * @param sandFraction          Fracción de arena de la capa activa.
     * @throws PhysicalInvariantViolationException si el resultado es negativo.
     */
    public static double calculateReferenceShearStress(double fluidDensity,
                                                       double submergedSpecificGravity,
                                                       double gravity,
                                                       double meanActiveDiameter,
                                                       double sandFraction) {
        double taursg = fluidDensity * submergedSpecificGravity * gravity * meanActiveDiameter
                * (0.021 + 0.015 * Math.exp(-20.0 * sandFraction));
        if (taursg < 0) {
            throw new PhysicalInvariantViolationException("Tensión de Shields de referencia negativa: " + taursg);
        }
        return taursg;
    }

    /**
     * Exponente de ocultamiento (hiding) de un grano respecto al diámetro medio activo.
     */
    public static double calculateHidingExponent(double diameter, double meanActiveDiameter) {
        return 0.67 / (1.0 + Math.exp(1.5 - diameter / meanActiveDiameter));
    }

    /**
     * Tasa de transporte adimensional W* de Wilcock &amp; Crowe.
     * <p>
     * Para φ &lt; 0 (entrada no física) se toma la parte real de la potencia compleja
     * principal, |φ|^7.5 · cos(7.5π).
     *
     * @param phi Relación τ / τr.
     */
    public static double calculateDimensionlessTransportRate(double phi) {
        assert !(phi < 0) : "τ/τr negativo: " + phi;
        if (phi < 0) {
            log.debug("τ/τr negativo ({}), se usa la parte real de la potencia compleja", phi);
            return LOW_TRANSPORT_COEFFICIENT * Math.pow(-phi, LOW_TRANSPORT_EXPONENT) * Math.cos(LOW_TRANSPORT_EXPONENT * Math.PI);
        }
        if (phi < PHI_TRANSITION) {
            return LOW_TRANSPORT_COEFFICIENT * Math.pow(phi, LOW_TRANSPORT_EXPONENT);
        }
        return HIGH_TRANSPORT_COEFFICIENT * Math.pow(1.0 - HIGH_TRANSPORT_OFFSET / Math.sqrt(phi), HIGH_TRANSPORT_EXPONENT);
    }

    /**
     * Volumen tras la abrasión exponencial de Sternberg.
     *
     * @param startingVolume Volumen antes de moverse [m³].
     * @param travelDistance Distancia total recorrida en el paso [m].
     * @param abrasionRate   Tasa de abrasión [1/m].
     * @throws PhysicalInvariantViolationException si el volumen aumenta.
     */
    public static double calculateParcelVolumePostAbrasion(double startingVolume, double travelDistance, double abrasionRate) {
        double volume = startingVolume * Math.exp(travelDistance * (-abrasionRate));
        if (volume > startingVolume) {
            throw new PhysicalInvariantViolationException(String.format(
                    "El volumen de la parcela *aumenta* por abrasión: %.6g -> %.6g", startingVolume, volume));
        }
        return volume;
    }

    /**
     * Diámetro tras la abrasión, escalando con la raíz cúbica del cociente de volúmenes.
     */
    public static double calculateGrainDiameterPostAbrasion(double startingDiameter, double preAbrasionVolume, double postAbrasionVolume) {
        if (postAbrasionVolume == preAbrasionVolume) {
            return startingDiameter;
        }
        return startingDiameter * Math.pow(postAbrasionVolume / preAbrasionVolume, 1.0 / 3.0);
    }
}
