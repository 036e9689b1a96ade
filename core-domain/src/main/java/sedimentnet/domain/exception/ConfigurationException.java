package sedimentnet.domain.exception;

/**
 * Argumentos de construcción inválidos: colaborador incorrecto, campo obligatorio
 * ausente, porosidad fuera de rango o método de transporte no soportado.
 * <p>
 * Es un error fatal. Se detecta antes de que el motor empiece a simular.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
