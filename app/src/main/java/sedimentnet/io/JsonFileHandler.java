package sedimentnet.io;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import sedimentnet.domain.scenario.SedimentScenario;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Serialización y deserialización JSON de escenarios, redes y resultados.
 * <p>
 * Genérica sobre cualquier objeto compatible con Jackson; {@link #readScenario(String)} es un
 * atajo para el caso más común.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y es thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // NaN aparece en cotas y ubicaciones de parcelas fuera de la red.
        mapper.enable(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, se sobrescribe.
     *
     * @param data     El objeto a serializar. No puede ser nulo.
     * @param filePath Ruta del archivo de destino (ej: "data/scenarios/cadena.json").
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada con éxito.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a un objeto del tipo indicado.
     *
     * @param filePath   La ruta del archivo JSON a leer.
     * @param objectType Clase destino (ej: SedimentScenario.class).
     * @throws IOException Si el archivo no existe o hay un error de lectura o formato.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee un escenario completo de simulación.
     *
     * @throws IOException Si el archivo no existe o no es un escenario válido. Los errores de
     *                     validación del escenario llegan envueltos por Jackson, con la
     *                     {@link sedimentnet.domain.exception.ConfigurationException} como causa.
     */
    public SedimentScenario readScenario(String filePath) throws IOException {
        return readFromFile(filePath, SedimentScenario.class);
    }
}
