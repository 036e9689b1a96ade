package sedimentnet.physics.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sedimentnet.domain.exception.PhysicalInvariantViolationException;
import sedimentnet.domain.network.FlowDirectionService;
import sedimentnet.domain.network.NetworkGraph;
import sedimentnet.domain.network.RiverNetwork;
import sedimentnet.factory.RiverNetworkFactory;
import sedimentnet.physics.routing.SteepestFlowDirector;
import sedimentnet.physics.solver.SedimentTransportEquations;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class BedElevationAdjusterTest {

    private static final double POROSITY = 0.3;

    private RiverNetwork network;
    private BedElevationAdjuster adjuster;

    @BeforeEach
    void setUp() {
        // Cadena de 3 tramos de 100 m x 15 m; roca madre 2.34, 1.56, 0.78, 0.0
        network = new RiverNetworkFactory().createStraightChain(3, 100.0, 15.0, 0.0, 0.0078);
        SteepestFlowDirector director = new SteepestFlowDirector(network);
        director.runOneStep();
        adjuster = new BedElevationAdjuster(network, director, POROSITY);
    }

    @Test
    @DisplayName("El aluvión se suma a la roca madre en los nodos con aportes; la cabecera no cambia")
    void adjustNodeElevations_shouldAddAlluviumToBedrock() {
        // ACT
        adjuster.adjustNodeElevations(new double[]{0.0, 300.0, 0.0});

        // ASSERT
        assertEquals(2.34, network.getTopographicElevation(0), 1e-12, "La cabecera conserva su cota.");
        // 2 * 300 / (1500 + 1500) / 0.7
        assertEquals(1.56 + 0.2857142857, network.getTopographicElevation(1), 1e-9);
        assertEquals(0.78, network.getTopographicElevation(2), 1e-12);
        assertEquals(0.0, network.getTopographicElevation(3), 1e-12, "La salida no tiene volumen aguas abajo.");
    }

    @Test
    @DisplayName("Las pendientes se recalculan con las cotas ajustadas")
    void updateChannelSlopes_shouldUseAdjustedElevations() {
        adjuster.adjustNodeElevations(new double[]{0.0, 300.0, 0.0});

        adjuster.updateChannelSlopes();

        double node1 = 1.56 + 0.2857142857;
        assertEquals((2.34 - node1) / 100.0, network.getChannelSlope(0), 1e-9);
        assertEquals((node1 - 0.78) / 100.0, network.getChannelSlope(1), 1e-9);
        assertEquals(0.0078, network.getChannelSlope(2), 1e-12);
    }

    @Test
    @DisplayName("Un tramo plano recibe la pendiente mínima")
    void updateChannelSlopes_shouldApplyFloor() {
        network.setTopographicElevation(2, 0.0);

        adjuster.updateChannelSlopes();

        assertEquals(SedimentTransportEquations.SLOPE_THRESHOLD, network.getChannelSlope(2), 1e-15);
    }

    @Test
    @DisplayName("Si el aluvión invierte la pendiente de un tramo se viola el invariante")
    void updateChannelSlopes_shouldRejectAdverseSlope() {
        adjuster.adjustNodeElevations(new double[]{0.0, 30000.0, 0.0});

        assertThrows(PhysicalInvariantViolationException.class, adjuster::updateChannelSlopes);
    }

    @Test
    @DisplayName("Los tramos que aportan a cada nodo se resuelven una sola vez al construir")
    void constructor_shouldQueryIncidenceOnce() {
        // ARRANGE
        FlowDirectionService flowDirector = mock(FlowDirectionService.class);
        when(flowDirector.flowLinkIncomingAtNode()).thenReturn(new int[][]{{-1, 0}, {1, -1}, {1, -1}, {1, 0}});
        when(flowDirector.linkToFlowReceivingNode(anyInt())).thenAnswer(inv -> {
            int node = inv.getArgument(0);
            return node < 3 ? node : NetworkGraph.NO_LINK;
        });
        BedElevationAdjuster mocked = new BedElevationAdjuster(network, flowDirector, POROSITY);

        // ACT
        mocked.adjustNodeElevations(new double[3]);
        mocked.adjustNodeElevations(new double[3]);

        // ASSERT
        verify(flowDirector, times(1)).flowLinkIncomingAtNode();
        verify(flowDirector, never()).linkToFlowReceivingNode(0);
    }
}
