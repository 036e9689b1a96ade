package sedimentnet.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;
import sedimentnet.domain.exception.ConfigurationException;

/**
 * Parámetros escalares del motor de transporte de sedimentos en red.
 */
@Value
@Builder
@With
@Jacksonized
public class TransporterConfig {

    /**
     * Nombre del único método de transporte soportado de serie (Wilcock & Crowe, 2003).
     */
    public static final String WILCOCK_CROWE = "WilcockCrowe";

    /**
     * Proporción de huecos entre granos en el lecho, en [0, 1).
     */
    @Builder.Default
    double bedPorosity = 0.3;

    /**
     * Aceleración de la gravedad [m/s²].
     */
    @Builder.Default
    double gravity = 9.81;

    /**
     * Densidad del fluido, normalmente agua [kg/m³].
     */
    @Builder.Default
    double fluidDensity = 1000.0;

    /**
     * Ley de transporte a utilizar.
     */
    @Builder.Default
    String transportMethod = WILCOCK_CROWE;

    public static TransporterConfig defaults() {
        return TransporterConfig.builder().build();
    }

    /**
     * Comprueba los rangos físicos de los parámetros.
     *
     * @throws ConfigurationException si algún parámetro está fuera de rango.
     */
    public void validate() {
        if (!(bedPorosity >= 0 && bedPorosity < 1)) {
            throw new ConfigurationException("La porosidad del lecho debe estar en [0, 1): " + bedPorosity);
        }
        if (!(gravity > 0)) {
            throw new ConfigurationException("La aceleración de la gravedad debe ser positiva: " + gravity);
        }
        if (!(fluidDensity > 0)) {
            throw new ConfigurationException("La densidad del fluido debe ser positiva: " + fluidDensity);
        }
        if (transportMethod == null || transportMethod.isBlank()) {
            throw new ConfigurationException("Hay que indicar un método de transporte.");
        }
    }
}
