package sedimentnet.physics.impl;

import lombok.extern.slf4j.Slf4j;
import sedimentnet.config.TransporterConfig;
import sedimentnet.domain.network.NetworkGraph;
import sedimentnet.domain.parcel.ParcelAttribute;
import sedimentnet.domain.parcel.ParcelStore;
import sedimentnet.domain.sediment.SedimentTransportState;
import sedimentnet.physics.i.ITransportLaw;
import sedimentnet.physics.solver.SedimentTransportEquations;

/**
 * Ley de transporte de fondo basada en la superficie del lecho de Wilcock &amp; Crowe (2003).
 * <p>
 * Responsabilidades:
 * 1. Recalcular, por tramo, el diámetro y la densidad medios de la capa activa y su fracción de arena.
 * 2. Calcular la tasa adimensional W* de cada parcela con ocultamiento (hiding).
 * 3. Convertir W* en una velocidad virtual aguas abajo para las parcelas activas.
 */
@Slf4j
public class WilcockCroweTransportLaw implements ITransportLaw {

    private final NetworkGraph graph;
    private final ParcelStore parcels;
    private final TransporterConfig config;

    public WilcockCroweTransportLaw(NetworkGraph graph, ParcelStore parcels, TransporterConfig config) {
        this.graph = graph;
        this.parcels = parcels;
        this.config = config;
    }

    @Override
    public String getName() {
        return TransporterConfig.WILCOCK_CROWE;
    }

    @Override
    public String getDescription() {
        return "Transporte de fondo por superficie con ocultamiento: W* = 0.002 φ^7.5 (φ < 1.35), 14 (1 - 0.894/√φ)^4.5";
    }

    @Override
    public void calculateVirtualVelocities(SedimentTransportState state, double[] flowDepth) {
        int timeIndex = state.getTimeIndex();
        boolean[] inNetwork = state.getInNetworkParcels();
        boolean[] active = state.getActiveParcels();
        double[] velocity = state.getParcelVelocity();

        double[] activeVolume = state.getActiveVolume();
        updateActiveLayerStatistics(state);

        double[] meanDiameter = state.getMeanActiveDiameter();
        double[] sandFraction = state.getActiveSandFraction();
        double[] thickness = state.getActiveLayerThickness();

        double rho = config.getFluidDensity();
        double g = config.getGravity();
        double fluidTerm = Math.pow(rho, 1.5) * g;

        for (int p = 0; p < inNetwork.length; p++) {
            velocity[p] = 0.0;
            if (!inNetwork[p]) {
                continue;
            }
            int link = parcels.getLink(p, timeIndex);
            double diameter = parcels.get(ParcelAttribute.D, p, timeIndex);
            double volume = parcels.get(ParcelAttribute.VOLUME, p, timeIndex);
            double submergedSpecificGravity = (parcels.get(ParcelAttribute.DENSITY, p, timeIndex) - rho) / rho;

            double taursg = SedimentTransportEquations.calculateReferenceShearStress(
                    rho, submergedSpecificGravity, g, meanDiameter[link], sandFraction[link]);

            if (!active[p]) {
                continue;
            }

            double relativeSize = diameter / meanDiameter[link];
            double b = SedimentTransportEquations.calculateHidingExponent(diameter, meanDiameter[link]);
            double taur = taursg * Math.pow(relativeSize, b);
            double tau = rho * g * flowDepth[link] * graph.getChannelSlope(link);
            double phi = tau / taur;

            double w = SedimentTransportEquations.calculateDimensionlessTransportRate(phi);
            double fraction = activeVolume[link] / volume;

            double v = w * Math.pow(tau, 1.5) * fraction
                    / fluidTerm / submergedSpecificGravity / thickness[link];
            velocity[p] = Double.isFinite(v) ? v : 0.0;
        }
    }

    /**
     * Diámetro y densidad medios de la capa activa y fracción de arena, por tramo.
     * Las medias quedan en el estado para la partición del siguiente paso.
     */
    private void updateActiveLayerStatistics(SedimentTransportState state) {
        int timeIndex = state.getTimeIndex();
        int links = graph.getNumberOfLinks();
        boolean[] active = state.getActiveParcels();

        double[] volume = new double[links];
        double[] diameterVolume = new double[links];
        double[] densityVolume = new double[links];
        double[] sandVolume = new double[links];

        for (int p = 0; p < active.length; p++) {
            if (!active[p]) {
                continue;
            }
            int link = parcels.getLink(p, timeIndex);
            double v = parcels.get(ParcelAttribute.VOLUME, p, timeIndex);
            double d = parcels.get(ParcelAttribute.D, p, timeIndex);
            volume[link] += v;
            diameterVolume[link] += d * v;
            densityVolume[link] += parcels.get(ParcelAttribute.DENSITY, p, timeIndex) * v;
            if (d < SedimentTransportEquations.SAND_GRAIN_DIAMETER) {
                sandVolume[link] += v;
            }
        }

        double[] meanDiameter = state.getMeanActiveDiameter();
        double[] meanDensity = state.getMeanActiveDensity();
        double[] sandFraction = state.getActiveSandFraction();
        double[] activeVolume = state.getActiveVolume();
        for (int l = 0; l < links; l++) {
            meanDiameter[l] = volume[l] > 0 ? diameterVolume[l] / volume[l] : Double.NaN;
            meanDensity[l] = volume[l] > 0 ? densityVolume[l] / volume[l] : Double.NaN;
            sandFraction[l] = activeVolume[l] != 0 ? sandVolume[l] / activeVolume[l] : 0.0;
            if (Double.isNaN(sandFraction[l])) {
                sandFraction[l] = 0.0;
            }
        }
        state.setActiveLayerMeansAvailable(true);
    }
}
