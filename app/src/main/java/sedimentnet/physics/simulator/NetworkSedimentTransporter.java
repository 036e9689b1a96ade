package sedimentnet.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import sedimentnet.config.TransporterConfig;
import sedimentnet.domain.exception.ConfigurationException;
import sedimentnet.domain.exception.ParcelExhaustionException;
import sedimentnet.domain.network.FlowDirectionService;
import sedimentnet.domain.network.NetworkGraph;
import sedimentnet.domain.parcel.ParcelAttribute;
import sedimentnet.domain.parcel.ParcelStore;
import sedimentnet.domain.sediment.LinkSedimentSnapshot;
import sedimentnet.domain.sediment.SedimentTransportState;
import sedimentnet.physics.i.ITransportLaw;
import sedimentnet.physics.impl.ActiveLayerPartitioner;
import sedimentnet.physics.impl.BedElevationAdjuster;
import sedimentnet.physics.impl.ParcelAdvector;
import sedimentnet.physics.impl.TimeStepAdvancer;
import sedimentnet.physics.impl.TransportLawRegistry;

/**
 * Motor de transporte de sedimentos por parcelas sobre una red fluvial.
 * <p>
 * Cada llamada a {@link #runOneStep(double)} ejecuta, en este orden fijo:
 * <ol>
 *     <li>apertura del corte temporal y selección de parcelas ({@link TimeStepAdvancer}),</li>
 *     <li>partición capa activa / almacenamiento y cotas de nodo ({@link ActiveLayerPartitioner}),</li>
 *     <li>recálculo de pendientes ({@link BedElevationAdjuster}),</li>
 *     <li>velocidades virtuales ({@link ITransportLaw}),</li>
 *     <li>desplazamiento y abrasión ({@link ParcelAdvector}).</li>
 * </ol>
 * El motor modifica en el sitio la red (cotas y pendientes) y el registro de parcelas.
 * No es thread safe.
 */
@Slf4j
public class NetworkSedimentTransporter {

    @Getter
    private final NetworkGraph graph;
    @Getter
    private final ParcelStore parcels;
    @Getter
    private final TransporterConfig config;
    private final double[][] flowDepth;

    private final SedimentTransportState state;
    private final TimeStepAdvancer advancer;
    private final BedElevationAdjuster elevationAdjuster;
    private final ActiveLayerPartitioner partitioner;
    @Getter
    private final ITransportLaw transportLaw;
    private final ParcelAdvector advector;

    public NetworkSedimentTransporter(NetworkGraph graph,
                                      ParcelStore parcels,
                                      FlowDirectionService flowDirector,
                                      double[][] flowDepth,
                                      TransporterConfig config) {
        this(graph, parcels, flowDirector, flowDepth, config, TransportLawRegistry.withDefaults());
    }

    /**
     * @param graph        Red fluvial. Sus cotas y pendientes se actualizan en cada paso.
     * @param parcels      Registro de parcelas, con al menos un corte temporal.
     * @param flowDirector Direcciones de flujo ya calculadas sobre {@code graph}.
     * @param flowDepth    Calado por [índice de tiempo][tramo] [m].
     * @param config       Parámetros escalares del motor.
     * @param registry     Leyes de transporte disponibles.
     * @throws ConfigurationException si alguna entrada es inválida.
     */
    public NetworkSedimentTransporter(NetworkGraph graph,
                                      ParcelStore parcels,
                                      FlowDirectionService flowDirector,
                                      double[][] flowDepth,
                                      TransporterConfig config,
                                      TransportLawRegistry registry) {
        if (graph == null) {
            throw new ConfigurationException("La red no puede ser nula.");
        }
        if (parcels == null) {
            throw new ConfigurationException("El registro de parcelas no puede ser nulo.");
        }
        if (flowDirector == null) {
            throw new ConfigurationException("El servicio de direcciones de flujo no puede ser nulo.");
        }
        if (config == null) {
            throw new ConfigurationException("La configuración del motor no puede ser nula.");
        }
        if (flowDirector.getGraph() != graph) {
            throw new ConfigurationException("Las direcciones de flujo se calcularon sobre otra red.");
        }
        for (ParcelAttribute attribute : ParcelAttribute.values()) {
            if (!parcels.hasAttribute(attribute)) {
                throw new ConfigurationException("Al registro de parcelas le falta el atributo '" + attribute.getKey() + "'.");
            }
        }
        config.validate();

        this.graph = graph;
        this.parcels = parcels;
        this.config = config;
        this.flowDepth = validateFlowDepth(flowDepth, graph.getNumberOfLinks());
        validateParcelLinks();

        this.transportLaw = registry.resolve(graph, parcels, config);
        this.state = new SedimentTransportState(graph.getNumberOfLinks());
        this.advancer = new TimeStepAdvancer(parcels);
        this.elevationAdjuster = new BedElevationAdjuster(graph, flowDirector, config.getBedPorosity());
        this.partitioner = new ActiveLayerPartitioner(graph, parcels, config, elevationAdjuster);
        this.advector = new ParcelAdvector(graph, parcels, flowDirector);

        if (!graph.hasChannelSlope()) {
            log.debug("La red no trae pendientes; se calculan a partir de la topografía");
            elevationAdjuster.updateChannelSlopes();
        }

        int timeIndex = parcels.getLatestTimeIndex();
        state.setTimeIndex(timeIndex);
        state.setTime(parcels.getTimeAt(timeIndex));
        int inNetwork = advancer.collectParcels(state);
        partitioner.partition(state, flowDepthAt(timeIndex));
        elevationAdjuster.updateChannelSlopes();

        log.info("NetworkSedimentTransporter inicializado. Tramos={}, Nodos={}, Parcelas en red={}, Ley={}",
                graph.getNumberOfLinks(), graph.getNumberOfNodes(), inNetwork, transportLaw.getName());
    }

    private static double[][] validateFlowDepth(double[][] flowDepth, int links) {
        if (flowDepth == null || flowDepth.length == 0) {
            throw new ConfigurationException("La matriz de calados no puede estar vacía.");
        }
        for (int t = 0; t < flowDepth.length; t++) {
            if (flowDepth[t] == null || flowDepth[t].length != links) {
                throw new ConfigurationException(String.format(
                        "La fila %d de calados tiene %d valores, se esperaban %d (uno por tramo).",
                        t, flowDepth[t] == null ? 0 : flowDepth[t].length, links));
            }
        }
        return flowDepth;
    }

    private void validateParcelLinks() {
        int timeIndex = parcels.getLatestTimeIndex();
        int links = graph.getNumberOfLinks();
        for (int p = 0; p < parcels.getNumberOfItems(); p++) {
            if (!parcels.hasRecordAt(p, timeIndex)) {
                continue;
            }
            int link = parcels.getLink(p, timeIndex);
            if (link != ParcelStore.OUT_OF_NETWORK && (link < 0 || link >= links)) {
                throw new ConfigurationException(String.format(
                        "La parcela %d está en el tramo %d, que no existe en una red de %d tramos.", p, link, links));
            }
        }
    }

    private double[] flowDepthAt(int timeIndex) {
        if (timeIndex >= flowDepth.length) {
            throw new IllegalStateException(String.format(
                    "No hay calados para el índice de tiempo %d (la matriz tiene %d filas).", timeIndex, flowDepth.length));
        }
        return flowDepth[timeIndex];
    }

    /**
     * Avanza el sistema un paso de tiempo.
     *
     * @param dt Duración del paso [s].
     * @throws ParcelExhaustionException       si no queda ninguna parcela en la red.
     * @throws IllegalStateException           si la matriz de calados no cubre el nuevo paso.
     * @throws sedimentnet.domain.exception.PhysicalInvariantViolationException si se viola un invariante físico.
     */
    public void runOneStep(double dt) {
        if (!(dt > 0)) {
            throw new IllegalArgumentException("El paso de tiempo debe ser positivo: " + dt);
        }
        int timeIndex = state.getTimeIndex() + 1;
        double[] depth = flowDepthAt(timeIndex);
        double time = state.getTime() + dt;

        int inNetwork = advancer.advance(state, timeIndex, time);
        if (inNetwork == 0) {
            throw new ParcelExhaustionException(String.format(
                    "No quedan parcelas en la red en el paso %d (t=%.1f s).", timeIndex, time));
        }

        partitioner.partition(state, depth);
        elevationAdjuster.updateChannelSlopes();
        transportLaw.calculateVirtualVelocities(state, depth);
        advector.advect(state, dt);

        log.debug("Paso {} completado (t={} s): {} parcelas en red, {} activas",
                timeIndex, time, inNetwork, state.countActive());
    }

    public double getTime() {
        return state.getTime();
    }

    public int getTimeIndex() {
        return state.getTimeIndex();
    }

    /**
     * Agregados por tramo del último paso.
     */
    public LinkSedimentSnapshot getLinkSnapshot() {
        return state.snapshot();
    }

    /**
     * Distancia total recorrida por una parcela desde el inicio [m]. 0 si nunca se ha movido.
     */
    public double getCumulativeDistanceTraveled(int parcelId) {
        if (parcelId < 0 || parcelId >= parcels.getNumberOfItems()) {
            throw new IndexOutOfBoundsException("Parcela fuera de rango: " + parcelId);
        }
        return state.getCumulativeDistance().getOrDefault(parcelId, 0.0);
    }

    /**
     * Velocidades virtuales del último paso, indexadas por parcela [m/s].
     */
    public double[] getParcelVelocities() {
        return state.getParcelVelocity().clone();
    }

    public int getParcelsInNetwork() {
        return state.countInNetwork();
    }

    public int getActiveParcels() {
        return state.countActive();
    }

    /**
     * Mediana de la distancia recorrida en el último paso por las parcelas activas [m].
     */
    public double getMedianActiveTravelDistance() {
        return ParcelAdvector.medianActiveDistance(state);
    }
}
