package sedimentnet.domain.parcel;

import lombok.Builder;
import lombok.With;
import sedimentnet.domain.exception.ConfigurationException;

/**
 * Estado inicial de una parcela de sedimento, tal como se inyecta en un {@link ParcelStore}.
 *
 * @param link           Tramo en el que se encuentra la parcela.
 * @param locationInLink Posición fraccional dentro del tramo, en [0, 1].
 * @param diameter       Diámetro de grano D [m].
 * @param volume         Volumen de la parcela [m³].
 * @param density        Densidad del sedimento [kg/m³].
 * @param abrasionRate   Tasa de abrasión de Sternberg [1/m].
 * @param arrivalTime    Índice de tiempo en el que la parcela llegó a su tramo actual.
 * @param active         Si la parcela parte en la capa activa.
 */
@Builder
@With
public record SedimentParcel(
        int link,
        double locationInLink,
        double diameter,
        double volume,
        double density,
        double abrasionRate,
        double arrivalTime,
        boolean active
) {
    public SedimentParcel {
        if (link < 0) {
            throw new ConfigurationException("Una parcela nueva debe estar dentro de la red (link >= 0): " + link);
        }
        if (!(locationInLink >= 0 && locationInLink <= 1)) {
            throw new ConfigurationException("La posición en el tramo debe estar en [0, 1]: " + locationInLink);
        }
        if (!(diameter > 0)) {
            throw new ConfigurationException("El diámetro de la parcela debe ser positivo: " + diameter);
        }
        if (!(volume >= 0)) {
            throw new ConfigurationException("El volumen de la parcela no puede ser negativo: " + volume);
        }
        if (!(density > 0)) {
            throw new ConfigurationException("La densidad de la parcela debe ser positiva: " + density);
        }
        if (!Double.isFinite(abrasionRate)) {
            throw new ConfigurationException("La tasa de abrasión debe ser finita: " + abrasionRate);
        }
    }
}
