package de.htwsaar.datalinker.datalink.link;

import java.util.Objects;

/**
 * Eingabeparameter eines Service-Deskriptors (VOTable {@code PARAM}).
 *
 * @param name      Parametername
 * @param datatype  VOTable-Datentyp ({@code char}, {@code double}, …)
 * @param arraysize Array-Größe ({@code *}, {@code 3}) oder {@code null}
 * @param unit      Einheit oder {@code null}
 * @param ucd       semantische Annotation (UCD)
 * @param xtype     erweiterter Typ ({@code circle}, {@code polygon}) oder {@code null}
 * @param value     Vorgabewert; leerer String für "kein Wert"
 */
public record ServiceParameter(
        String name, String datatype, String arraysize, String unit, String ucd, String xtype, String value) {

    public ServiceParameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(datatype, "datatype must not be null");
        value = value == null ? "" : value;
    }
}
