package sedimentnet.domain.scenario;

import lombok.Builder;
import lombok.With;
import sedimentnet.config.TransporterConfig;
import sedimentnet.domain.exception.ConfigurationException;
import sedimentnet.domain.network.RiverNetwork;
import sedimentnet.domain.parcel.SedimentParcel;

import java.util.List;
import java.util.Objects;

/**
 * Escenario completo de simulación: red, parcelas iniciales, parámetros del motor y
 * forzamiento hidráulico externo.
 *
 * @param network     Red fluvial con su geometría y cotas.
 * @param parcels     Parcelas presentes en t = 0.
 * @param transporter Parámetros del motor (null para los valores por defecto).
 * @param flowDepth   Calado por [paso de tiempo][tramo], con timesteps + 1 filas [m].
 * @param timeStep    Duración de cada paso [s].
 * @param timesteps   Número de pasos a simular.
 */
@Builder
@With
public record SedimentScenario(
        RiverNetwork network,
        List<SedimentParcel> parcels,
        TransporterConfig transporter,
        double[][] flowDepth,
        double timeStep,
        int timesteps
) {
    public SedimentScenario {
        if (network == null) {
            throw new ConfigurationException("El escenario no define la red.");
        }
        if (flowDepth == null) {
            throw new ConfigurationException("El escenario no define el calado (flowDepth).");
        }
        if (!(timeStep > 0)) {
            throw new ConfigurationException("El paso de tiempo debe ser positivo: " + timeStep);
        }
        if (timesteps < 0) {
            throw new ConfigurationException("El número de pasos no puede ser negativo: " + timesteps);
        }
        parcels = parcels == null ? List.of() : List.copyOf(parcels);
        transporter = Objects.requireNonNullElseGet(transporter, TransporterConfig::defaults);
    }
}
