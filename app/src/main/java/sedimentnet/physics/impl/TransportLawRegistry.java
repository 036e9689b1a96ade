package sedimentnet.physics.impl;

import lombok.extern.slf4j.Slf4j;
import sedimentnet.config.TransporterConfig;
import sedimentnet.domain.exception.ConfigurationException;
import sedimentnet.domain.network.NetworkGraph;
import sedimentnet.domain.parcel.ParcelStore;
import sedimentnet.physics.i.ITransportLaw;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Catálogo de leyes de transporte disponibles, indexado por el nombre que aparece en
 * {@link TransporterConfig#getTransportMethod()}.
 */
@Slf4j
public class TransportLawRegistry {

    /**
     * Construye una ley ligada a una red y un registro de parcelas concretos.
     */
    @FunctionalInterface
    public interface TransportLawFactory {
        ITransportLaw create(NetworkGraph graph, ParcelStore parcels, TransporterConfig config);
    }

    private final Map<String, TransportLawFactory> factories = new LinkedHashMap<>();

    /**
     * Registro con las leyes incluidas de serie.
     */
    public static TransportLawRegistry withDefaults() {
        TransportLawRegistry registry = new TransportLawRegistry();
        registry.register(TransporterConfig.WILCOCK_CROWE, WilcockCroweTransportLaw::new);
        return registry;
    }

    public void register(String name, TransportLawFactory factory) {
        if (name == null || name.isBlank() || factory == null) {
            throw new IllegalArgumentException("El nombre y la factoría de la ley de transporte son obligatorios.");
        }
        if (factories.put(name, factory) != null) {
            log.warn("Ley de transporte '{}' reemplazada en el registro", name);
        }
    }

    public boolean supports(String name) {
        return factories.containsKey(name);
    }

    public Set<String> getRegisteredNames() {
        return Set.copyOf(factories.keySet());
    }

    /**
     * @throws ConfigurationException si el método de la configuración no está registrado.
     */
    public ITransportLaw resolve(NetworkGraph graph, ParcelStore parcels, TransporterConfig config) {
        TransportLawFactory factory = factories.get(config.getTransportMethod());
        if (factory == null) {
            throw new ConfigurationException(String.format(
                    "Método de transporte no soportado: '%s'. Disponibles: %s", config.getTransportMethod(), factories.keySet()));
        }
        return factory.create(graph, parcels, config);
    }
}
