package sedimentnet.domain.exception;

/**
 * Se ha violado un invariante físico del modelo durante un paso de tiempo:
 * pendiente negativa, espesor de aluvión negativo, tensión de Shields de
 * referencia negativa o una parcela cuyo volumen crece por abrasión.
 * <p>
 * El paso puede haber mutado parcialmente el estado compartido (cotas, pendientes,
 * atributos de parcelas). No hay rollback: la simulación debe darse por terminada.
 */
public class PhysicalInvariantViolationException extends IllegalStateException {

    public PhysicalInvariantViolationException(String message) {
        super(message);
    }
}
