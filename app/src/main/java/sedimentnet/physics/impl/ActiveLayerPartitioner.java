package sedimentnet.physics.impl;

import lombok.extern.slf4j.Slf4j;
import sedimentnet.config.TransporterConfig;
import sedimentnet.domain.network.NetworkGraph;
import sedimentnet.domain.parcel.ParcelAttribute;
import sedimentnet.domain.parcel.ParcelStore;
import sedimentnet.domain.sediment.SedimentTransportState;
import sedimentnet.physics.solver.SedimentTransportEquations;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Reparte las parcelas de cada tramo entre la capa activa (móvil) y la capa de
 * almacenamiento (enterrada), y actualiza la cota de los nodos con lo almacenado.
 * <p>
 * El espesor de capa activa sigue a Wong et al. (2007) con el diámetro y la densidad medios
 * de la capa activa del paso <b>anterior</b>, lo que evita iterar entre "qué granos son
 * activos" y "qué tamaño tiene la capa activa". En el arranque se usan todas las parcelas
 * presentes en el tramo.
 * <p>
 * La clasificación es First-In-Last-Out: el sedimento que llegó más tarde cubre al más
 * antiguo y se moviliza antes.
 */
@Slf4j
public class ActiveLayerPartitioner {

    private final NetworkGraph graph;
    private final ParcelStore parcels;
    private final TransporterConfig config;
    private final BedElevationAdjuster elevationAdjuster;

    public ActiveLayerPartitioner(NetworkGraph graph,
                                  ParcelStore parcels,
                                  TransporterConfig config,
                                  BedElevationAdjuster elevationAdjuster) {
        this.graph = graph;
        this.parcels = parcels;
        this.config = config;
        this.elevationAdjuster = elevationAdjuster;
    }

    /**
     * Ejecuta la partición del paso actual y ajusta la cota de los nodos.
     *
     * @param state     Estado de trabajo (parcelas del paso ya clasificadas por {@link TimeStepAdvancer}).
     * @param flowDepth Calado de cada tramo en este paso [m].
     */
    public void partition(SedimentTransportState state, double[] flowDepth) {
        int timeIndex = state.getTimeIndex();
        int links = graph.getNumberOfLinks();
        boolean[] inNetwork = state.getInNetworkParcels();

        double[] totalVolume = state.getTotalVolume();
        System.arraycopy(parcels.sumByLink(ParcelAttribute.VOLUME, timeIndex, inNetwork, links), 0, totalVolume, 0, links);

        List<List<Integer>> parcelsByLink = groupByLink(inNetwork, timeIndex, links);

        if (timeIndex <= 1 || !state.isActiveLayerMeansAvailable()) {
            bootstrapMeans(state, parcelsByLink);
        }

        computeActiveLayerThickness(state, flowDepth);

        double[] capacity = state.getCapacity();
        double[] thickness = state.getActiveLayerThickness();
        for (int l = 0; l < links; l++) {
            capacity[l] = graph.getChannelWidth(l) * graph.getLinkLength(l) * thickness[l];
        }

        for (int l = 0; l < links; l++) {
            if (totalVolume[l] > 0) {
                classifyFirstInLastOut(parcelsByLink.get(l), capacity[l], timeIndex);
            }
        }

        boolean[] active = state.getActiveParcels();
        for (int p = 0; p < active.length; p++) {
            active[p] = inNetwork[p] && parcels.get(ParcelAttribute.ACTIVE_LAYER, p, timeIndex) == ParcelStore.ACTIVE;
        }

        double[] activeVolume = state.getActiveVolume();
        System.arraycopy(parcels.sumByLink(ParcelAttribute.VOLUME, timeIndex, active, links), 0, activeVolume, 0, links);

        double[] storedVolume = state.getStoredVolume();
        for (int l = 0; l < links; l++) {
            storedVolume[l] = (totalVolume[l] - activeVolume[l]) / (1.0 - config.getBedPorosity());
        }

        log.debug("Paso {}: {} parcelas activas, volumen almacenado total {} m³",
                timeIndex, state.countActive(), Arrays.stream(storedVolume).sum());

        elevationAdjuster.adjustNodeElevations(storedVolume);
    }

    /**
     * Agrupa las parcelas del paso por su tramo actual.
     */
    private List<List<Integer>> groupByLink(boolean[] inNetwork, int timeIndex, int links) {
        List<List<Integer>> byLink = new ArrayList<>(links);
        for (int l = 0; l < links; l++) {
            byLink.add(new ArrayList<>());
        }
        for (int p = 0; p < inNetwork.length; p++) {
            if (inNetwork[p]) {
                byLink.get(parcels.getLink(p, timeIndex)).add(p);
            }
        }
        return byLink;
    }

    /**
     * Medias ponderadas por volumen de todas las parcelas de cada tramo: en el arranque
     * todavía no existe distinción entre capa activa y almacenamiento.
     */
    private void bootstrapMeans(SedimentTransportState state, List<List<Integer>> parcelsByLink) {
        int timeIndex = state.getTimeIndex();
        double[] meanDiameter = state.getMeanActiveDiameter();
        double[] meanDensity = state.getMeanActiveDensity();

        for (int l = 0; l < parcelsByLink.size(); l++) {
            double volume = 0.0;
            double diameterVolume = 0.0;
            double densityVolume = 0.0;
            for (int p : parcelsByLink.get(l)) {
                double v = parcels.get(ParcelAttribute.VOLUME, p, timeIndex);
                volume += v;
                diameterVolume += parcels.get(ParcelAttribute.D, p, timeIndex) * v;
                densityVolume += parcels.get(ParcelAttribute.DENSITY, p, timeIndex) * v;
            }
            // 0/0 deja NaN en los tramos vacíos, igual que en los pasos normales.
            meanDiameter[l] = diameterVolume / volume;
            meanDensity[l] = densityVolume / volume;
        }
        state.setActiveLayerMeansAvailable(true);
    }

    private void computeActiveLayerThickness(SedimentTransportState state, double[] flowDepth) {
        double[] thickness = state.getActiveLayerThickness();
        double[] meanDiameter = state.getMeanActiveDiameter();
        double[] meanDensity = state.getMeanActiveDensity();

        double finiteSum = 0.0;
        int finiteCount = 0;
        for (int l = 0; l < thickness.length; l++) {
            thickness[l] = SedimentTransportEquations.calculateActiveLayerThickness(
                    config.getFluidDensity(), config.getGravity(), graph.getChannelSlope(l), flowDepth[l],
                    meanDensity[l], meanDiameter[l]);
            if (Double.isFinite(thickness[l])) {
                finiteSum += thickness[l];
                finiteCount++;
            }
        }

        if (finiteCount == 0) {
            log.warn("Paso {}: ningún tramo da un espesor finito, se usa {} m", state.getTimeIndex(),
                    SedimentTransportEquations.FALLBACK_ACTIVE_LAYER_THICKNESS);
            Arrays.fill(thickness, SedimentTransportEquations.FALLBACK_ACTIVE_LAYER_THICKNESS);
            return;
        }

        // Tramos sin parcelas (o bajo el umbral) reciben la media de los demás.
        double average = finiteSum / finiteCount;
        for (int l = 0; l < thickness.length; l++) {
            if (!Double.isFinite(thickness[l])) {
                thickness[l] = average;
            }
        }
    }

    /**
     * Ordena las parcelas del tramo de la más reciente a la más antigua y las marca activas
     * hasta que el volumen acumulado supera la capacidad.
     */
    private void classifyFirstInLastOut(List<Integer> parcelsInLink, double capacity, int timeIndex) {
        List<Integer> sorted = new ArrayList<>(parcelsInLink);
        sorted.sort(Comparator
                .comparingDouble((Integer p) -> parcels.get(ParcelAttribute.TIME_ARRIVAL_IN_LINK, p, timeIndex))
                .thenComparingInt(p -> p)
                .reversed());

        double cumulativeVolume = 0.0;
        for (int p : sorted) {
            cumulativeVolume += parcels.get(ParcelAttribute.VOLUME, p, timeIndex);
            double flag = cumulativeVolume > capacity ? ParcelStore.INACTIVE : ParcelStore.ACTIVE;
            parcels.set(ParcelAttribute.ACTIVE_LAYER, p, timeIndex, flag);
        }
    }
}
