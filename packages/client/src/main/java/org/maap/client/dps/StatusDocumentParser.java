package org.maap.client.dps;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.maap.client.exception.DocumentParseException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Decodes the documents returned by the DPS API into plain values. No I/O.
 *
 * <p>XML tags are matched by suffix so that namespace prefixes ({@code wps:Status},
 * {@code ns0:Status}) do not matter. Sample status document:
 *
 * <pre>{@code
 * <wps:StatusInfo xmlns:wps="http://www.opengis.net/wps/2.0">
 *   <wps:JobID>50314f32-6099-47fa-8270-c378ac5ff83b</wps:JobID>
 *   <wps:Status>Succeeded</wps:Status>
 * </wps:StatusInfo>
 * }</pre>
 */
public final class StatusDocumentParser {
  private static final String[] ID_SUFFIXES = {"self.id", "JobID"};

  private final ObjectMapper mapper;

  public StatusDocumentParser() {
    this(new ObjectMapper());
  }

  public StatusDocumentParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /** Job id and status text from a status document. */
  public record StatusInfo(String jobId, String status) {}

  /** Output URLs and error lines from a results document, in document order. */
  public record ResultDocument(List<String> outputs, List<String> traceback) {}

  public SubmissionAck parseAck(String body) {
    if (body == null || body.isBlank()) {
      throw new DocumentParseException("Empty submission acknowledgment", body, null);
    }
    try {
      SubmissionAck ack = mapper.readValue(body, SubmissionAck.class);
      if (ack.status() == null) {
        throw new DocumentParseException("Acknowledgment has no status field", body, null);
      }
      if (ack.isSuccess() && (ack.jobId() == null || ack.jobId().isBlank())) {
        throw new DocumentParseException("Successful acknowledgment has no job_id", body, null);
      }
      return ack;
    } catch (JsonProcessingException e) {
      throw new DocumentParseException("Malformed submission acknowledgment", body, e);
    }
  }

  public StatusInfo parseStatus(String xml) {
    Element root = parseXml(xml);
    String jobId = null;
    String status = null;
    for (Element child : children(root)) {
      String tag = child.getNodeName();
      if (endsWithAny(tag, ID_SUFFIXES)) {
        jobId = child.getTextContent().trim();
      } else if (tag.endsWith("Status")) {
        status = child.getTextContent().trim();
      }
    }
    if (status == null || status.isEmpty()) {
      throw new DocumentParseException("Status document has no Status element", xml, null);
    }
    return new StatusInfo(jobId, status);
  }

  public ResultDocument parseResults(String xml) {
    Element root = parseXml(xml);
    List<String> outputs = new ArrayList<>();
    List<String> traceback = new ArrayList<>();
    for (Element child : children(root)) {
      String tag = child.getNodeName();
      if (tag.endsWith("Output")) {
        for (Element data : children(child)) {
          if (data.getNodeName().endsWith("Data")) {
            outputs.add(data.getTextContent().trim());
          }
        }
      } else if (tag.endsWith("Error")) {
        for (Element line : children(child)) {
          traceback.add(line.getTextContent());
        }
      }
    }
    return new ResultDocument(outputs, traceback);
  }

  /** Flat metrics document to a name → value map; empty elements map to an empty string. */
  public Map<String, String> parseMetrics(String xml) {
    Element root = parseXml(xml);
    Map<String, String> metrics = new LinkedHashMap<>();
    for (Element child : children(root)) {
      metrics.put(localName(child.getNodeName()), child.getTextContent().trim());
    }
    return metrics;
  }

  private static Element parseXml(String xml) {
    if (xml == null || xml.isBlank()) {
      throw new DocumentParseException("Empty XML document", xml, null);
    }
    try {
      DocumentBuilder builder = newFactory().newDocumentBuilder();
      // fatal errors still throw; recoverable ones are not echoed to stderr
      builder.setErrorHandler(new DefaultHandler());
      Document doc = builder.parse(new InputSource(new StringReader(xml)));
      return doc.getDocumentElement();
    } catch (SAXException | IOException e) {
      throw new DocumentParseException("Malformed XML document", xml, e);
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser is not available", e);
    }
  }

  private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(false);
    factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
    factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    factory.setExpandEntityReferences(false);
    return factory;
  }

  private static List<Element> children(Element parent) {
    List<Element> result = new ArrayList<>();
    NodeList nodes = parent.getChildNodes();
    for (int i = 0; i < nodes.getLength(); i++) {
      Node n = nodes.item(i);
      if (n.getNodeType() == Node.ELEMENT_NODE) result.add((Element) n);
    }
    return result;
  }

  private static boolean endsWithAny(String tag, String[] suffixes) {
    for (String s : suffixes) {
      if (tag.endsWith(s)) return true;
    }
    return false;
  }

  private static String localName(String tag) {
    int colon = tag.indexOf(':');
    return colon < 0 ? tag.trim() : tag.substring(colon + 1).trim();
  }
}
