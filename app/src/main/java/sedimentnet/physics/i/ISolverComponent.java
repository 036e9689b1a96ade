package sedimentnet.physics.i;

/**
 * Contrato base para cualquier componente numérico del motor.
 * Permite tratar las leyes de transporte de forma polimórfica para tareas
 * de logging e identificación, sin importar su física.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "WilcockCrowe").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
