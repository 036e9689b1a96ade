package sedimentnet.physics.i;

import sedimentnet.domain.sediment.SedimentTransportState;

/**
 * Ley de transporte de fondo que asigna a cada parcela activa una velocidad virtual
 * aguas abajo.
 */
public interface ITransportLaw extends ISolverComponent {
    /**
     * Calcula la velocidad virtual de todas las parcelas del paso actual.
     * <p>
     * Lee la pertenencia a la capa activa y el espesor de capa de {@code state}, escribe
     * {@code state.getParcelVelocity()} y actualiza los agregados por tramo (medias activas,
     * fracción de arena) que el siguiente paso usa para particionar.
     *
     * @param state     Estado de trabajo del paso.
     * @param flowDepth Calado de cada tramo en este paso [m].
     */
    void calculateVirtualVelocities(SedimentTransportState state, double[] flowDepth);
}
