package sedimentnet.physics.impl;

import lombok.extern.slf4j.Slf4j;
import sedimentnet.domain.parcel.ParcelStore;
import sedimentnet.domain.sediment.SedimentTransportState;

/**
 * Abre el corte temporal de cada paso y determina qué parcelas participan en él.
 */
@Slf4j
public class TimeStepAdvancer {

    private final ParcelStore parcels;

    public TimeStepAdvancer(ParcelStore parcels) {
        this.parcels = parcels;
    }

    /**
     * Añade un corte en {@code time} (arrastrando los valores del anterior) y clasifica
     * las parcelas del nuevo instante.
     *
     * @return Número de parcelas dentro de la red en este paso.
     */
    public int advance(SedimentTransportState state, int timeIndex, double time) {
        if (parcels.getLatestTimeIndex() < timeIndex) {
            parcels.addTimeSlice(time);
        }
        state.setTimeIndex(timeIndex);
        state.setTime(time);
        return collectParcels(state);
    }

    /**
     * Clasifica las parcelas del último corte sin abrir uno nuevo (pasada de inicialización).
     *
     * @return Número de parcelas dentro de la red.
     */
    public int collectParcels(SedimentTransportState state) {
        int timeIndex = state.getTimeIndex();
        int n = parcels.getNumberOfItems();
        state.resizeParcels(n);

        boolean[] inNetwork = state.getInNetworkParcels();
        int count = 0;
        for (int p = 0; p < n; p++) {
            inNetwork[p] = parcels.hasRecordAt(p, timeIndex) && parcels.getLink(p, timeIndex) != ParcelStore.OUT_OF_NETWORK;
            if (inNetwork[p]) count++;
        }
        log.debug("Paso {}: {} de {} parcelas dentro de la red", timeIndex, count, n);
        return count;
    }
}
