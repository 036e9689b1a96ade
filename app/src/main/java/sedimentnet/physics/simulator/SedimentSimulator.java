package sedimentnet.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import sedimentnet.domain.exception.ParcelExhaustionException;
import sedimentnet.domain.parcel.ParcelRecord;
import sedimentnet.domain.scenario.SedimentScenario;
import sedimentnet.domain.sediment.LinkSedimentSnapshot;
import sedimentnet.domain.sediment.TransportStepSummary;
import sedimentnet.physics.routing.SteepestFlowDirector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Orquesta una simulación completa a partir de un {@link SedimentScenario}.
 * Facade de alto nivel sobre {@link NetworkSedimentTransporter}.
 * <p>
 * La red del escenario se modifica en el sitio durante la simulación.
 */
@Slf4j
public class SedimentSimulator {

    private final SedimentScenario scenario;
    @Getter
    private final ParcelRecord parcels;
    @Getter
    private final SteepestFlowDirector flowDirector;
    @Getter
    private final NetworkSedimentTransporter transporter;

    public SedimentSimulator(SedimentScenario scenario) {
        this.scenario = scenario;
        this.flowDirector = new SteepestFlowDirector(scenario.network());
        this.flowDirector.runOneStep();
        this.parcels = new ParcelRecord(0.0, scenario.parcels());
        this.transporter = new NetworkSedimentTransporter(
                scenario.network(), parcels, flowDirector, scenario.flowDepth(), scenario.transporter());
        log.info("SedimentSimulator inicializado. Pasos={}, dt={} s, Parcelas={}",
                scenario.timesteps(), scenario.timeStep(), parcels.getNumberOfItems());
    }

    /**
     * Ejecuta todos los pasos del escenario.
     * <p>
     * Si las parcelas se agotan antes del final, la simulación se detiene y se devuelven los
     * pasos completados.
     *
     * @return Un resumen por paso completado.
     */
    public List<TransportStepSummary> run() {
        List<TransportStepSummary> summaries = new ArrayList<>(scenario.timesteps());
        for (int step = 0; step < scenario.timesteps(); step++) {
            try {
                transporter.runOneStep(scenario.timeStep());
            } catch (ParcelExhaustionException e) {
                log.warn("Simulación detenida tras {} de {} pasos: {}", step, scenario.timesteps(), e.getMessage());
                break;
            }
            summaries.add(summarize());
        }
        log.info("Simulación finalizada: {} pasos, t={} s", summaries.size(), transporter.getTime());
        return Collections.unmodifiableList(summaries);
    }

    private TransportStepSummary summarize() {
        LinkSedimentSnapshot snapshot = transporter.getLinkSnapshot();
        return new TransportStepSummary(
                transporter.getTimeIndex(),
                transporter.getTime(),
                transporter.getParcelsInNetwork(),
                transporter.getActiveParcels(),
                Arrays.stream(snapshot.totalVolume()).sum(),
                Arrays.stream(snapshot.activeVolume()).sum(),
                transporter.getMedianActiveTravelDistance());
    }
}
