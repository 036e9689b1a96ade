package sedimentnet.domain.sediment;

import lombok.Getter;
import lombok.Setter;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Estado de trabajo de un paso de transporte.
 * <p>
 * Pertenece en exclusiva a una instancia del motor: se crea al construirlo y cada fase lo
 * actualiza en el sitio. Los arrays por tramo tienen tamaño fijo; los arrays por parcela se
 * redimensionan cuando se inyectan parcelas nuevas.
 */
@Getter
public class SedimentTransportState {

    private final int numberOfLinks;

    @Setter
    private int timeIndex;
    @Setter
    private double time;

    // --- Por parcela ---
    /** Parcelas de este paso: con registro y dentro de la red. */
    private boolean[] inNetworkParcels = new boolean[0];
    private boolean[] activeParcels = new boolean[0];
    /** Velocidad virtual aguas abajo [m/s]. */
    private double[] parcelVelocity = new double[0];
    /** Distancia recorrida en el paso actual [m]. */
    private double[] travelDistance = new double[0];

    /** Distancia acumulada por identificador de parcela [m]. */
    private final Map<Integer, Double> cumulativeDistance = new HashMap<>();

    // --- Por tramo ---
    /** Diámetro medio de la capa activa del paso anterior [m]. */
    private final double[] meanActiveDiameter;
    /** Densidad media de la capa activa del paso anterior [kg/m³]. */
    private final double[] meanActiveDensity;
    @Setter
    private boolean activeLayerMeansAvailable;

    private final double[] activeLayerThickness;
    private final double[] capacity;
    private final double[] totalVolume;
    private final double[] activeVolume;
    private final double[] storedVolume;
    private final double[] activeSandFraction;

    public SedimentTransportState(int numberOfLinks) {
        this.numberOfLinks = numberOfLinks;
        this.meanActiveDiameter = nanArray(numberOfLinks);
        this.meanActiveDensity = nanArray(numberOfLinks);
        this.activeLayerThickness = new double[numberOfLinks];
        this.capacity = new double[numberOfLinks];
        this.totalVolume = new double[numberOfLinks];
        this.activeVolume = new double[numberOfLinks];
        this.storedVolume = new double[numberOfLinks];
        this.activeSandFraction = new double[numberOfLinks];
    }

    private static double[] nanArray(int size) {
        double[] array = new double[size];
        Arrays.fill(array, Double.NaN);
        return array;
    }

    /**
     * Ajusta los arrays por parcela al número actual de parcelas del registro.
     * Los valores se reinician; las fases los rellenan en cada paso.
     */
    public void resizeParcels(int numberOfParcels) {
        if (inNetworkParcels.length != numberOfParcels) {
            inNetworkParcels = new boolean[numberOfParcels];
            activeParcels = new boolean[numberOfParcels];
            parcelVelocity = new double[numberOfParcels];
            travelDistance = new double[numberOfParcels];
        } else {
            Arrays.fill(inNetworkParcels, false);
            Arrays.fill(activeParcels, false);
            Arrays.fill(parcelVelocity, 0.0);
            Arrays.fill(travelDistance, 0.0);
        }
    }

    public int countInNetwork() {
        return count(inNetworkParcels);
    }

    public int countActive() {
        return count(activeParcels);
    }

    private static int count(boolean[] mask) {
        int total = 0;
        for (boolean b : mask) {
            if (b) total++;
        }
        return total;
    }

    /**
     * Copia inmutable de los agregados por tramo.
     */
    public LinkSedimentSnapshot snapshot() {
        return new LinkSedimentSnapshot(
                totalVolume, activeVolume, storedVolume, activeSandFraction,
                activeLayerThickness, capacity, meanActiveDiameter, meanActiveDensity);
    }
}
