package sedimentnet.physics.impl;

import lombok.extern.slf4j.Slf4j;
import sedimentnet.domain.network.FlowDirectionService;
import sedimentnet.domain.network.NetworkGraph;
import sedimentnet.domain.parcel.ParcelAttribute;
import sedimentnet.domain.parcel.ParcelStore;
import sedimentnet.domain.sediment.SedimentTransportState;
import sedimentnet.physics.solver.SedimentTransportEquations;

import java.util.Arrays;
import java.util.Map;

/**
 * Desplaza las parcelas aguas abajo con su velocidad virtual y aplica la abrasión.
 * <p>
 * La velocidad del tramo de partida se mantiene en todos los tramos que la parcela atraviesa
 * durante el paso. Una parcela que sale por un nodo sin tramo receptor queda retirada de la red
 * ({@link ParcelStore#OUT_OF_NETWORK}) para siempre.
 */
@Slf4j
public class ParcelAdvector {

    private final NetworkGraph graph;
    private final ParcelStore parcels;
    private final FlowDirectionService flowDirector;

    public ParcelAdvector(NetworkGraph graph, ParcelStore parcels, FlowDirectionService flowDirector) {
        this.graph = graph;
        this.parcels = parcels;
        this.flowDirector = flowDirector;
    }

    /**
     * Mueve las parcelas del paso actual.
     *
     * @param state Estado con las velocidades ya calculadas.
     * @param dt    Duración del paso [s].
     */
    public void advect(SedimentTransportState state, double dt) {
        int timeIndex = state.getTimeIndex();
        boolean[] inNetwork = state.getInNetworkParcels();
        double[] velocity = state.getParcelVelocity();
        double[] distance = state.getTravelDistance();
        Map<Integer, Double> cumulative = state.getCumulativeDistance();

        for (int p = 0; p < inNetwork.length; p++) {
            if (!inNetwork[p]) {
                continue;
            }
            distance[p] = velocity[p] * dt;
            cumulative.merge(p, distance[p], Double::sum);
        }

        if (log.isDebugEnabled()) {
            log.debug("Paso {}: distancia mediana recorrida por la capa activa = {} m",
                    timeIndex, medianActiveDistance(state));
        }

        int exited = 0;
        for (int p = 0; p < inNetwork.length; p++) {
            if (!inNetwork[p] || distance[p] == 0.0) {
                continue;
            }
            if (moveParcel(p, distance[p], timeIndex)) {
                exited++;
            }
            applyAbrasion(p, distance[p], timeIndex);
        }
        if (exited > 0) {
            log.debug("Paso {}: {} parcelas han salido de la red", timeIndex, exited);
        }
    }

    /**
     * Recorre los tramos aguas abajo hasta agotar la distancia del paso.
     *
     * @return {@code true} si la parcela ha salido de la red.
     */
    private boolean moveParcel(int p, double travelDistance, int timeIndex) {
        int link = parcels.getLink(p, timeIndex);
        double location = parcels.get(ParcelAttribute.LOCATION_IN_LINK, p, timeIndex);

        double linkLength = graph.getLinkLength(link);
        double distanceToExit = linkLength * (1.0 - location);
        double distanceWithinLink = linkLength * location;
        double travelled = 0.0;

        while (travelled + distanceToExit <= travelDistance) {
            travelled += distanceToExit;
            distanceWithinLink = 0.0;
            link = flowDirector.downstreamLinkOf(link);
            parcels.set(ParcelAttribute.TIME_ARRIVAL_IN_LINK, p, timeIndex, timeIndex);

            if (link == NetworkGraph.NO_LINK) {
                parcels.setLink(p, timeIndex, ParcelStore.OUT_OF_NETWORK);
                parcels.set(ParcelAttribute.LOCATION_IN_LINK, p, timeIndex, Double.NaN);
                return true;
            }
            distanceToExit = graph.getLinkLength(link);
        }

        double restingDistance = distanceWithinLink + travelDistance - travelled;
        parcels.setLink(p, timeIndex, link);
        parcels.set(ParcelAttribute.LOCATION_IN_LINK, p, timeIndex, restingDistance / graph.getLinkLength(link));
        return false;
    }

    private void applyAbrasion(int p, double travelDistance, int timeIndex) {
        double volume = parcels.get(ParcelAttribute.VOLUME, p, timeIndex);
        double newVolume = SedimentTransportEquations.calculateParcelVolumePostAbrasion(
                volume, travelDistance, parcels.get(ParcelAttribute.ABRASION_RATE, p, timeIndex));
        double newDiameter = SedimentTransportEquations.calculateGrainDiameterPostAbrasion(
                parcels.get(ParcelAttribute.D, p, timeIndex), volume, newVolume);
        parcels.set(ParcelAttribute.VOLUME, p, timeIndex, newVolume);
        parcels.set(ParcelAttribute.D, p, timeIndex, newDiameter);
    }

    /**
     * Mediana de la distancia del paso entre las parcelas activas. NaN si no hay ninguna.
     */
    public static double medianActiveDistance(SedimentTransportState state) {
        boolean[] active = state.getActiveParcels();
        double[] distance = state.getTravelDistance();
        double[] values = new double[active.length];
        int n = 0;
        for (int p = 0; p < active.length; p++) {
            if (active[p]) {
                values[n++] = distance[p];
            }
        }
        if (n == 0) {
            return Double.NaN;
        }
        double[] sorted = Arrays.copyOf(values, n);
        Arrays.sort(sorted);
        return n % 2 == 1 ? sorted[n / 2] : 0.5 * (sorted[n / 2 - 1] + sorted[n / 2]);
    }
}
