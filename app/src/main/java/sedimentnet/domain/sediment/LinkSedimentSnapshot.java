package sedimentnet.domain.sediment;

import java.util.Objects;

/**
 * "Instantánea" inmutable de los agregados de sedimento de cada tramo al final de un paso.
 *
 * @param totalVolume          Volumen total de parcelas en la red [m³].
 * @param activeVolume         Volumen de la capa activa [m³].
 * @param storedVolume         Volumen almacenado, corregido por porosidad [m³].
 * @param activeSandFraction   Fracción de arena (D &lt; 2 mm) de la capa activa.
 * @param activeLayerThickness Espesor de la capa activa [m].
 * @param capacity             Capacidad de la capa activa [m³].
 * @param meanActiveDiameter   Diámetro medio de la capa activa [m].
 * @param meanActiveDensity    Densidad media de la capa activa [kg/m³].
 */
public record LinkSedimentSnapshot(
        double[] totalVolume,
        double[] activeVolume,
        double[] storedVolume,
        double[] activeSandFraction,
        double[] activeLayerThickness,
        double[] capacity,
        double[] meanActiveDiameter,
        double[] meanActiveDensity
) {
    public LinkSedimentSnapshot {
        Objects.requireNonNull(totalVolume, "El volumen total no puede ser nulo.");
        Objects.requireNonNull(activeVolume, "El volumen activo no puede ser nulo.");
        Objects.requireNonNull(storedVolume, "El volumen almacenado no puede ser nulo.");
        Objects.requireNonNull(activeSandFraction, "La fracción de arena no puede ser nula.");
        Objects.requireNonNull(activeLayerThickness, "El espesor de capa activa no puede ser nulo.");
        Objects.requireNonNull(capacity, "La capacidad no puede ser nula.");
        Objects.requireNonNull(meanActiveDiameter, "El diámetro medio no puede ser nulo.");
        Objects.requireNonNull(meanActiveDensity, "La densidad media no puede ser nula.");

        totalVolume = totalVolume.clone();
        activeVolume = activeVolume.clone();
        storedVolume = storedVolume.clone();
        activeSandFraction = activeSandFraction.clone();
        activeLayerThickness = activeLayerThickness.clone();
        capacity = capacity.clone();
        meanActiveDiameter = meanActiveDiameter.clone();
        meanActiveDensity = meanActiveDensity.clone();
    }

    public int getNumberOfLinks() {
        return totalVolume.length;
    }
}
