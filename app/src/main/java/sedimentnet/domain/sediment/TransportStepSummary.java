package sedimentnet.domain.sediment;

/**
 * Resumen de diagnóstico de un paso de transporte.
 *
 * @param timeIndex            Índice del paso.
 * @param time                 Tiempo simulado al final del paso [s].
 * @param parcelsInNetwork     Parcelas dentro de la red al inicio del paso.
 * @param activeParcels        Parcelas en la capa activa.
 * @param totalVolume          Volumen total en la red [m³].
 * @param activeVolume         Volumen total de la capa activa [m³].
 * @param medianTravelDistance Mediana de la distancia recorrida por las parcelas activas [m].
 */
public record TransportStepSummary(
        int timeIndex,
        double time,
        int parcelsInNetwork,
        int activeParcels,
        double totalVolume,
        double activeVolume,
        double medianTravelDistance
) {
}
