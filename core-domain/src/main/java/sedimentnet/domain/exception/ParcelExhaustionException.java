package sedimentnet.domain.exception;

/**
 * No queda ninguna parcela dentro de la red al inicio de un paso de tiempo.
 */
public class ParcelExhaustionException extends IllegalStateException {

    public ParcelExhaustionException(String message) {
        super(message);
    }
}
