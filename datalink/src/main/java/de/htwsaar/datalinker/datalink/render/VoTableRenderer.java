package de.htwsaar.datalinker.datalink.render;

import de.htwsaar.datalinker.datalink.link.AssembledLinks;
import de.htwsaar.datalinker.datalink.link.LinkEntry;
import de.htwsaar.datalinker.datalink.link.MalformedEntryException;
import de.htwsaar.datalinker.datalink.link.ServiceDescriptor;
import de.htwsaar.datalinker.datalink.link.ServiceParameter;
import de.htwsaar.datalinker.datalink.signing.ExpiryWindow;
import java.io.StringWriter;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Rendert Link-Zeilen und Service-Deskriptoren als IVOA-DataLink-VOTable (VOTable 1.3).
 *
 * <p>Die Feldreihenfolge ist Teil des externen Vertrags:
 * {@code ID, access_url, service_def, error_message, description, semantics, content_type, content_length}.
 * Jeder Deskriptor wird eine eigene {@code RESOURCE type="meta"} neben der Ergebnis-Tabelle.</p>
 */
public class VoTableRenderer {

    public static final String VOTABLE_NAMESPACE = "http://www.ivoa.net/xml/VOTable/v1.3";

    /** Spalten der DataLink-Tabelle in Ausgabereihenfolge. */
    public static final List<Field> FIELDS = List.of(
            new Field("ID", "char", "*", "meta.id;meta.main", null),
            new Field("access_url", "char", "*", "meta.ref.url", null),
            new Field("service_def", "char", "*", "meta.ref", null),
            new Field("error_message", "char", "*", "meta.code.error", null),
            new Field("description", "char", "*", "meta.note", null),
            new Field("semantics", "char", "*", "meta.code", null),
            new Field("content_type", "char", "*", "meta.code.mime", null),
            new Field("content_length", "long", null, "phys.size;meta.file", "byte"));

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();
    private final LinksCachePolicy cachePolicy;

    public VoTableRenderer(LinksCachePolicy cachePolicy) {
        this.cachePolicy = Objects.requireNonNull(cachePolicy, "cachePolicy must not be null");
    }

    public DataLinkDocument render(AssembledLinks links) {
        return render(links.entries(), links.descriptors(), links.window());
    }

    /**
     * @param entries     Zeilen in Ausgabereihenfolge
     * @param descriptors Service-Deskriptoren
     * @param window      Ablauf-Fenster für die Cache-Vorgabe
     * @return gerendertes Dokument
     * @throws MalformedEntryException wenn eine Zeile nicht wohlgeformt ist oder auf einen fehlenden Deskriptor zeigt
     */
    public DataLinkDocument render(List<LinkEntry> entries, List<ServiceDescriptor> descriptors, ExpiryWindow window) {
        validate(entries, descriptors);

        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = outputFactory.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            newline(xml, 0);
            xml.writeStartElement("VOTABLE");
            xml.writeDefaultNamespace(VOTABLE_NAMESPACE);
            xml.writeAttribute("version", "1.3");

            newline(xml, 1);
            xml.writeStartElement("RESOURCE");
            xml.writeAttribute("type", "results");
            newline(xml, 2);
            xml.writeStartElement("TABLE");
            for (Field field : FIELDS) {
                newline(xml, 3);
                writeField(xml, field);
            }
            newline(xml, 3);
            xml.writeStartElement("DATA");
            newline(xml, 4);
            xml.writeStartElement("TABLEDATA");
            for (LinkEntry entry : entries) {
                newline(xml, 5);
                writeRow(xml, entry);
            }
            newline(xml, 4);
            xml.writeEndElement(); // TABLEDATA
            newline(xml, 3);
            xml.writeEndElement(); // DATA
            newline(xml, 2);
            xml.writeEndElement(); // TABLE
            newline(xml, 1);
            xml.writeEndElement(); // RESOURCE

            for (ServiceDescriptor descriptor : descriptors) {
                newline(xml, 1);
                writeDescriptor(xml, descriptor);
            }

            newline(xml, 0);
            xml.writeEndElement(); // VOTABLE
            xml.writeEndDocument();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Unable to render DataLink VOTable", e);
        }

        return new DataLinkDocument(out.toString(), cachePolicy.maxAge(window));
    }

    private static void validate(List<LinkEntry> entries, List<ServiceDescriptor> descriptors) {
        Set<String> descriptorIds = new HashSet<>();
        for (ServiceDescriptor descriptor : descriptors) {
            if (!descriptorIds.add(descriptor.id())) {
                throw new MalformedEntryException("Duplicate service descriptor id " + descriptor.id());
            }
        }
        for (LinkEntry entry : entries) {
            if (!entry.isWellFormed()) {
                throw new MalformedEntryException("Link entry for " + entry.id() + " (" + entry.semantics()
                        + ") must carry exactly one of access_url, service_def, error_message but has "
                        + entry.populatedTargets());
            }
            if (entry.serviceDef() != null && !entry.serviceDef().isEmpty() && !descriptorIds.contains(entry.serviceDef())) {
                throw new MalformedEntryException("Link entry references unknown service descriptor " + entry.serviceDef());
            }
        }
    }

    private static void writeField(XMLStreamWriter xml, Field field) throws XMLStreamException {
        xml.writeEmptyElement("FIELD");
        xml.writeAttribute("name", field.name());
        xml.writeAttribute("datatype", field.datatype());
        if (field.arraysize() != null) xml.writeAttribute("arraysize", field.arraysize());
        xml.writeAttribute("ucd", field.ucd());
        if (field.unit() != null) xml.writeAttribute("unit", field.unit());
    }

    private static void writeRow(XMLStreamWriter xml, LinkEntry entry) throws XMLStreamException {
        xml.writeStartElement("TR");
        cell(xml, entry.id());
        cell(xml, entry.accessUrl());
        cell(xml, entry.serviceDef());
        cell(xml, entry.errorMessage());
        cell(xml, entry.description());
        cell(xml, entry.semantics());
        cell(xml, entry.contentType());
        cell(xml, entry.contentLength() == null ? null : entry.contentLength().toString());
        xml.writeEndElement();
    }

    private static void cell(XMLStreamWriter xml, String value) throws XMLStreamException {
        xml.writeStartElement("TD");
        if (value != null && !value.isEmpty()) {
            xml.writeCharacters(value);
        }
        xml.writeEndElement();
    }

    private static void writeDescriptor(XMLStreamWriter xml, ServiceDescriptor descriptor) throws XMLStreamException {
        xml.writeStartElement("RESOURCE");
        xml.writeAttribute("type", "meta");
        xml.writeAttribute("utype", "adhoc:service");
        xml.writeAttribute("ID", descriptor.id());
        newline(xml, 2);
        writeFixedParam(xml, "standardID", descriptor.standardId());
        newline(xml, 2);
        writeFixedParam(xml, "accessURL", descriptor.accessUrl());
        newline(xml, 2);
        xml.writeStartElement("GROUP");
        xml.writeAttribute("name", "inputParams");
        for (ServiceParameter param : descriptor.inputParams()) {
            newline(xml, 3);
            writeInputParam(xml, param);
        }
        newline(xml, 2);
        xml.writeEndElement(); // GROUP
        newline(xml, 1);
        xml.writeEndElement(); // RESOURCE
    }

    private static void writeFixedParam(XMLStreamWriter xml, String name, String value) throws XMLStreamException {
        xml.writeEmptyElement("PARAM");
        xml.writeAttribute("name", name);
        xml.writeAttribute("datatype", "char");
        xml.writeAttribute("arraysize", "*");
        xml.writeAttribute("value", value);
    }

    private static void writeInputParam(XMLStreamWriter xml, ServiceParameter param) throws XMLStreamException {
        xml.writeEmptyElement("PARAM");
        xml.writeAttribute("name", param.name());
        xml.writeAttribute("datatype", param.datatype());
        if (param.arraysize() != null) xml.writeAttribute("arraysize", param.arraysize());
        if (param.unit() != null) xml.writeAttribute("unit", param.unit());
        if (param.ucd() != null) xml.writeAttribute("ucd", param.ucd());
        if (param.xtype() != null) xml.writeAttribute("xtype", param.xtype());
        xml.writeAttribute("value", param.value());
    }

    private static void newline(XMLStreamWriter xml, int depth) throws XMLStreamException {
        xml.writeCharacters("\n" + "  ".repeat(depth));
    }

    /**
     * Spaltendefinition der DataLink-Tabelle.
     */
    public record Field(String name, String datatype, String arraysize, String ucd, String unit) {}
}
