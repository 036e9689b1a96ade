package sedimentnet.factory;

import lombok.extern.slf4j.Slf4j;
import sedimentnet.domain.exception.ConfigurationException;
import sedimentnet.domain.network.RiverNetwork;

import java.util.Arrays;

/**
 * Fábrica de redes fluviales sencillas para escenarios de prueba y demostración.
 * <p>
 * Las cotas iniciales son las de la roca madre: el motor les suma el aluvión en su primera
 * pasada. Los tramos se orientan de aguas arriba (cola) a aguas abajo (cabeza).
 */
@Slf4j
public class RiverNetworkFactory {

    /**
     * Cadena recta de tramos iguales con pendiente uniforme.
     * <p>
     * El nodo 0 es la cabecera y el nodo {@code numberOfLinks} la salida.
     *
     * @param numberOfLinks    Número de tramos (>= 1).
     * @param linkLength       Longitud de cada tramo [m].
     * @param channelWidth     Ancho del cauce [m].
     * @param outletElevation  Cota de la roca madre en la salida [m].
     * @param bedSlope         Pendiente de la roca madre (m/m).
     */
    public RiverNetwork createStraightChain(int numberOfLinks,
                                            double linkLength,
                                            double channelWidth,
                                            double outletElevation,
                                            double bedSlope) {
        if (numberOfLinks < 1) {
            throw new ConfigurationException("Una cadena necesita al menos un tramo: " + numberOfLinks);
        }
        validateGeometry(linkLength, channelWidth, bedSlope);

        int nodes = numberOfLinks + 1;
        int[][] nodesAtLink = new int[numberOfLinks][];
        double[] x = new double[nodes];
        double[] y = new double[nodes];
        double[] bedrock = new double[nodes];
        for (int n = 0; n < nodes; n++) {
            x[n] = n * linkLength;
            bedrock[n] = outletElevation + bedSlope * linkLength * (numberOfLinks - n);
        }
        for (int l = 0; l < numberOfLinks; l++) {
            nodesAtLink[l] = new int[]{l, l + 1};
        }
        double[] lengths = new double[numberOfLinks];
        Arrays.fill(lengths, linkLength);
        double[] widths = new double[numberOfLinks];
        Arrays.fill(widths, channelWidth);

        log.debug("Cadena recta creada: {} tramos de {} m, pendiente {}", numberOfLinks, linkLength, bedSlope);
        return new RiverNetwork(nodesAtLink, x, y, lengths, widths, bedrock, null, null);
    }

    /**
     * Confluencia en Y: dos afluentes (tramos 0 y 1) que se unen en el nodo 2 y drenan por
     * el tramo 2 hasta la salida (nodo 3).
     *
     * @param linkLength      Longitud de cada tramo [m].
     * @param channelWidth    Ancho del cauce [m].
     * @param outletElevation Cota de la roca madre en la salida [m].
     * @param bedSlope        Pendiente de la roca madre (m/m).
     */
    public RiverNetwork createConfluence(double linkLength,
                                         double channelWidth,
                                         double outletElevation,
                                         double bedSlope) {
        validateGeometry(linkLength, channelWidth, bedSlope);

        double drop = bedSlope * linkLength;
        int[][] nodesAtLink = {{0, 2}, {1, 2}, {2, 3}};
        double offset = linkLength / Math.sqrt(2.0);
        double[] x = {0.0, 0.0, offset, offset + linkLength};
        double[] y = {offset, -offset, 0.0, 0.0};
        double[] bedrock = {outletElevation + 2 * drop, outletElevation + 2 * drop, outletElevation + drop, outletElevation};
        double[] lengths = {linkLength, linkLength, linkLength};
        double[] widths = {channelWidth, channelWidth, channelWidth};

        log.debug("Confluencia en Y creada: tramos de {} m, pendiente {}", linkLength, bedSlope);
        return new RiverNetwork(nodesAtLink, x, y, lengths, widths, bedrock, null, null);
    }

    /**
     * Matriz de calados constante de {@code timesteps + 1} filas.
     */
    public double[][] createUniformFlowDepth(int timesteps, int numberOfLinks, double depth) {
        double[][] flowDepth = new double[timesteps + 1][numberOfLinks];
        for (double[] row : flowDepth) {
            Arrays.fill(row, depth);
        }
        return flowDepth;
    }

    private static void validateGeometry(double linkLength, double channelWidth, double bedSlope) {
        if (!(linkLength > 0)) {
            throw new ConfigurationException("La longitud de tramo debe ser positiva: " + linkLength);
        }
        if (!(channelWidth >= 0)) {
            throw new ConfigurationException("El ancho del cauce no puede ser negativo: " + channelWidth);
        }
        if (!(bedSlope >= 0)) {
            throw new ConfigurationException("La pendiente de la roca madre no puede ser negativa: " + bedSlope);
        }
    }
}
