package sedimentnet.domain.parcel;

import sedimentnet.domain.network.NetworkGraph;

/**
 * Registro columnar, indexado por tiempo y sólo de adición, de los atributos de las parcelas.
 * <p>
 * Hay una fila por parcela y un corte (slice) por instante simulado. Abrir un corte nuevo
 * arrastra los valores del anterior; el motor los sobrescribe durante el paso.
 */
public interface ParcelStore {

    /**
     * Tramo ficticio de las parcelas que han abandonado la red.
     */
    int OUT_OF_NETWORK = NetworkGraph.NO_LINK - 1;

    double ACTIVE = 1.0;
    double INACTIVE = 0.0;

    int getNumberOfItems();

    int getNumberOfTimes();

    default int getLatestTimeIndex() {
        return getNumberOfTimes() - 1;
    }

    double getTimeAt(int timeIndex);

    /**
     * Abre un corte nuevo copiando el anterior (atributos variables y tramo actual).
     *
     * @param time Tiempo simulado del corte [s].
     */
    void addTimeSlice(double time);

    boolean hasAttribute(ParcelAttribute attribute);

    /**
     * @return {@code false} si la parcela se inyectó después de {@code timeIndex}.
     */
    boolean hasRecordAt(int item, int timeIndex);

    /**
     * Lee un atributo. Los atributos fijos ignoran {@code timeIndex}.
     */
    double get(ParcelAttribute attribute, int item, int timeIndex);

    void set(ParcelAttribute attribute, int item, int timeIndex, double value);

    int getLink(int item, int timeIndex);

    void setLink(int item, int timeIndex, int link);

    /**
     * Suma un atributo sobre las parcelas filtradas, agrupando por su tramo en {@code timeIndex}.
     * Las parcelas fuera de la red no contribuyen.
     *
     * @param filter Máscara por parcela, o {@code null} para todas las que tengan registro.
     * @return Array de longitud {@code numberOfLinks}; 0 en tramos sin parcelas.
     */
    double[] sumByLink(ParcelAttribute attribute, int timeIndex, boolean[] filter, int numberOfLinks);

    /**
     * Inyecta una parcela en el último corte.
     *
     * @return Identificador estable de la nueva parcela.
     */
    int addParcel(SedimentParcel parcel);
}
