package sedimentnet.domain.parcel;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Implementación en memoria de {@link ParcelStore}.
 * <p>
 * Cada atributo variable se guarda como una lista de cortes ({@code double[]} por instante);
 * los atributos fijos como un único array por parcela. Las parcelas inyectadas a mitad de la
 * simulación no tienen registro en los cortes anteriores: allí su tramo es
 * {@link #OUT_OF_NETWORK} y sus atributos NaN.
 */
@Slf4j
public class ParcelRecord implements ParcelStore {

    private final List<Double> times = new ArrayList<>();
    private final Map<ParcelAttribute, List<double[]>> timeVarying = new EnumMap<>(ParcelAttribute.class);
    private final Map<ParcelAttribute, double[]> fixed = new EnumMap<>(ParcelAttribute.class);
    private final List<int[]> links = new ArrayList<>();
    private int[] firstTimeIndex;
    private int itemCount;

    /**
     * Crea el registro con un único corte en {@code initialTime}.
     *
     * @param initialTime Tiempo simulado del primer corte [s].
     * @param parcels     Parcelas presentes al inicio (puede estar vacío).
     */
    public ParcelRecord(double initialTime, List<SedimentParcel> parcels) {
        Objects.requireNonNull(parcels, "La lista de parcelas no puede ser nula.");
        int n = parcels.size();
        this.itemCount = n;
        this.firstTimeIndex = new int[n];
        this.times.add(initialTime);

        for (ParcelAttribute attribute : ParcelAttribute.values()) {
            if (attribute.isTimeVarying()) {
                List<double[]> slices = new ArrayList<>();
                slices.add(new double[n]);
                timeVarying.put(attribute, slices);
            } else {
                fixed.put(attribute, new double[n]);
            }
        }
        int[] initialLinks = new int[n];
        links.add(initialLinks);

        for (int p = 0; p < n; p++) {
            SedimentParcel parcel = Objects.requireNonNull(parcels.get(p), "Parcela nula en la posición " + p);
            initialLinks[p] = parcel.link();
            writeParcel(parcel, p, 0);
        }
        log.debug("ParcelRecord creado con {} parcelas en t={}", n, initialTime);
    }

    private void writeParcel(SedimentParcel parcel, int item, int timeIndex) {
        timeVarying.get(ParcelAttribute.TIME_ARRIVAL_IN_LINK).get(timeIndex)[item] = parcel.arrivalTime();
        timeVarying.get(ParcelAttribute.ACTIVE_LAYER).get(timeIndex)[item] = parcel.active() ? ACTIVE : INACTIVE;
        timeVarying.get(ParcelAttribute.LOCATION_IN_LINK).get(timeIndex)[item] = parcel.locationInLink();
        timeVarying.get(ParcelAttribute.D).get(timeIndex)[item] = parcel.diameter();
        timeVarying.get(ParcelAttribute.VOLUME).get(timeIndex)[item] = parcel.volume();
        fixed.get(ParcelAttribute.DENSITY)[item] = parcel.density();
        fixed.get(ParcelAttribute.ABRASION_RATE)[item] = parcel.abrasionRate();
    }

    @Override
    public int getNumberOfItems() {
        return itemCount;
    }

    @Override
    public int getNumberOfTimes() {
        return times.size();
    }

    @Override
    public double getTimeAt(int timeIndex) {
        validateTimeIndex(timeIndex);
        return times.get(timeIndex);
    }

    @Override
    public void addTimeSlice(double time) {
        int previous = getLatestTimeIndex();
        if (time < times.get(previous)) {
            throw new IllegalArgumentException(String.format("El tiempo del nuevo corte (%.3f) es anterior al último (%.3f).", time, times.get(previous)));
        }
        times.add(time);
        for (List<double[]> slices : timeVarying.values()) {
            slices.add(slices.get(previous).clone());
        }
        links.add(links.get(previous).clone());
    }

    @Override
    public boolean hasAttribute(ParcelAttribute attribute) {
        return timeVarying.containsKey(attribute) || fixed.containsKey(attribute);
    }

    @Override
    public boolean hasRecordAt(int item, int timeIndex) {
        validateItem(item);
        validateTimeIndex(timeIndex);
        return firstTimeIndex[item] <= timeIndex;
    }

    @Override
    public double get(ParcelAttribute attribute, int item, int timeIndex) {
        validateItem(item);
        if (!attribute.isTimeVarying()) {
            return fixed.get(attribute)[item];
        }
        validateTimeIndex(timeIndex);
        return timeVarying.get(attribute).get(timeIndex)[item];
    }

    @Override
    public void set(ParcelAttribute attribute, int item, int timeIndex, double value) {
        validateItem(item);
        if (!attribute.isTimeVarying()) {
            fixed.get(attribute)[item] = value;
            return;
        }
        validateTimeIndex(timeIndex);
        timeVarying.get(attribute).get(timeIndex)[item] = value;
    }

    @Override
    public int getLink(int item, int timeIndex) {
        validateItem(item);
        validateTimeIndex(timeIndex);
        return links.get(timeIndex)[item];
    }

    @Override
    public void setLink(int item, int timeIndex, int link) {
        validateItem(item);
        validateTimeIndex(timeIndex);
        links.get(timeIndex)[item] = link;
    }

    @Override
    public double[] sumByLink(ParcelAttribute attribute, int timeIndex, boolean[] filter, int numberOfLinks) {
        validateTimeIndex(timeIndex);
        if (filter != null && filter.length != itemCount) {
            throw new IllegalArgumentException(String.format("El filtro tiene %d entradas, se esperaban %d.", filter.length, itemCount));
        }
        double[] totals = new double[numberOfLinks];
        int[] linkSlice = links.get(timeIndex);
        for (int p = 0; p < itemCount; p++) {
            if (filter != null ? !filter[p] : firstTimeIndex[p] > timeIndex) {
                continue;
            }
            int link = linkSlice[p];
            if (link < 0 || link >= numberOfLinks) {
                continue;
            }
            totals[link] += get(attribute, p, timeIndex);
        }
        return totals;
    }

    @Override
    public int addParcel(SedimentParcel parcel) {
        Objects.requireNonNull(parcel, "La parcela a inyectar no puede ser nula.");
        int item = itemCount;
        int latest = getLatestTimeIndex();
        int newCount = itemCount + 1;

        for (List<double[]> slices : timeVarying.values()) {
            for (int t = 0; t < slices.size(); t++) {
                double[] grown = Arrays.copyOf(slices.get(t), newCount);
                grown[item] = Double.NaN;
                slices.set(t, grown);
            }
        }
        for (Map.Entry<ParcelAttribute, double[]> entry : fixed.entrySet()) {
            entry.setValue(Arrays.copyOf(entry.getValue(), newCount));
        }
        for (int t = 0; t < links.size(); t++) {
            int[] grown = Arrays.copyOf(links.get(t), newCount);
            grown[item] = OUT_OF_NETWORK;
            links.set(t, grown);
        }
        firstTimeIndex = Arrays.copyOf(firstTimeIndex, newCount);
        firstTimeIndex[item] = latest;
        itemCount = newCount;

        links.get(latest)[item] = parcel.link();
        writeParcel(parcel, item, latest);
        log.debug("Parcela {} inyectada en el tramo {} (corte {})", item, parcel.link(), latest);
        return item;
    }

    private void validateItem(int item) {
        if (item < 0 || item >= itemCount) {
            throw new IndexOutOfBoundsException(String.format("Parcela fuera de rango: %d. El rango válido es de 0 a %d.", item, itemCount - 1));
        }
    }

    private void validateTimeIndex(int timeIndex) {
        if (timeIndex < 0 || timeIndex >= times.size()) {
            throw new IndexOutOfBoundsException(String.format("Índice de tiempo fuera de rango: %d. El rango válido es de 0 a %d.", timeIndex, times.size() - 1));
        }
    }
}
