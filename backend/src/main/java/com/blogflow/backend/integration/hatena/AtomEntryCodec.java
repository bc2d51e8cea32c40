package com.blogflow.backend.integration.hatena;

import com.blogflow.backend.capability.model.PublishedPost;
import com.blogflow.backend.workflow.error.ContentValidationException;
import com.blogflow.backend.workflow.error.TransientExternalException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

/** Writes AtomPub entry documents and reads the entry the server sends back. */
final class AtomEntryCodec {

  static final String ATOM_NS = "http://www.w3.org/2005/Atom";
  static final String APP_NS = "http://www.w3.org/2007/app";

  private AtomEntryCodec() {}

  static String writeEntry(AtomEntry entry) {
    try {
      Document document = newBuilder().newDocument();
      Element root = document.createElementNS(ATOM_NS, "entry");
      root.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, "xmlns:app", APP_NS);
      document.appendChild(root);

      appendText(document, root, "title", entry.title());
      Element author = document.createElementNS(ATOM_NS, "author");
      appendText(document, author, "name", entry.author());
      root.appendChild(author);
      Element content = appendText(document, root, "content", entry.content());
      content.setAttribute("type", "text/x-markdown");
      for (String category : entry.categories()) {
        Element element = document.createElementNS(ATOM_NS, "category");
        element.setAttribute("term", category);
        root.appendChild(element);
      }
      Element control = document.createElementNS(APP_NS, "app:control");
      Element draft = document.createElementNS(APP_NS, "app:draft");
      draft.setTextContent(entry.draft() ? "yes" : "no");
      control.appendChild(draft);
      root.appendChild(control);

      Transformer transformer = transformerFactory().newTransformer();
      transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
      StringWriter writer = new StringWriter();
      transformer.transform(new DOMSource(document), new StreamResult(writer));
      return writer.toString();
    } catch (ParserConfigurationException | TransformerException ex) {
      throw new IllegalStateException("Unable to build Atom entry", ex);
    }
  }

  static PublishedPost readPublished(String xml, boolean draft) {
    if (xml == null || xml.isBlank()) {
      throw new TransientExternalException("Blog returned an empty entry");
    }
    Document document;
    try {
      document = newBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    } catch (ParserConfigurationException ex) {
      throw new IllegalStateException("XML parser unavailable", ex);
    } catch (SAXException | IOException ex) {
      throw new ContentValidationException("Blog returned malformed Atom", ex);
    }
    String alternate = null;
    NodeList links = document.getElementsByTagNameNS(ATOM_NS, "link");
    for (int i = 0; i < links.getLength(); i++) {
      Element link = (Element) links.item(i);
      if ("alternate".equals(link.getAttribute("rel"))) {
        alternate = link.getAttribute("href");
        break;
      }
    }
    NodeList ids = document.getElementsByTagNameNS(ATOM_NS, "id");
    String entryId = ids.getLength() > 0 ? ids.item(0).getTextContent().trim() : null;
    if (alternate == null || alternate.isBlank()) {
      throw new ContentValidationException("Blog entry has no alternate link");
    }
    return new PublishedPost(alternate, entryId, draft);
  }

  private static Element appendText(Document document, Element parent, String name, String text) {
    Element element = document.createElementNS(ATOM_NS, name);
    element.setTextContent(text);
    parent.appendChild(element);
    return element;
  }

  private static DocumentBuilder newBuilder() throws ParserConfigurationException {
    DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
    factory.setNamespaceAware(true);
    factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    factory.setXIncludeAware(false);
    factory.setExpandEntityReferences(false);
    return factory.newDocumentBuilder();
  }

  private static TransformerFactory transformerFactory() {
    TransformerFactory factory = TransformerFactory.newInstance();
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
    return factory;
  }

  record AtomEntry(
      String title, String author, String content, List<String> categories, boolean draft) {}
}
