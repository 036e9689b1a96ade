package sedimentnet.domain.parcel;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Atributos obligatorios de una parcela de sedimento.
 * <p>
 * Los atributos variables en el tiempo tienen un valor por parcela y por instante; la
 * densidad y la tasa de abrasión son propiedades fijas de la parcela.
 */
@Getter
@RequiredArgsConstructor
public enum ParcelAttribute {
    TIME_ARRIVAL_IN_LINK("time_arrival_in_link", true),
    ABRASION_RATE("abrasion_rate", false),
    DENSITY("density", false),
    ACTIVE_LAYER("active_layer", true),
    LOCATION_IN_LINK("location_in_link", true),
    D("D", true),
    VOLUME("volume", true);

    /** Nombre del atributo en los ficheros de escenario y en los logs. */
    private final String key;
    private final boolean timeVarying;
}
