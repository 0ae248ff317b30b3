package io.huskytests.core.container;

import io.huskytests.core.model.TestCaseOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a structured test result document and returns one {@link TestCaseOutcome}
 * per {@code <test-case>} element, in document order.
 *
 * <p>Expected shape of each record:
 * <pre>{@code
 * <test-case id="0-1001" name="Adds" fullname="Calc.Tests.Adds" result="Failed" duration="0.012">
 *   <failure><message>expected 2</message><stack-trace>at ...</stack-trace></failure>
 *   <output>captured text</output>
 * </test-case>
 * }</pre>
 */
public final class ResultArtifactParser {

    private static final Logger log = LoggerFactory.getLogger(ResultArtifactParser.class);

    private static final String TEST_CASE_QUERY = "//test-case";

    public List<TestCaseOutcome> parse(Path resultFile) {
        try (InputStream in = Files.newInputStream(resultFile)) {
            return parse(in, resultFile.toString());
        } catch (IOException e) {
            throw new ResultArtifactException("Unable to read result file " + resultFile, e);
        }
    }

    public List<TestCaseOutcome> parse(InputStream in, String sourceName) {
        Document document;
        try {
            document = newDocumentBuilder().parse(in);
        } catch (SAXException | IOException e) {
            throw new ResultArtifactException("Malformed result file " + sourceName, e);
        }

        NodeList nodes;
        try {
            nodes = (NodeList) XPathFactory.newInstance().newXPath()
                    .evaluate(TEST_CASE_QUERY, document, XPathConstants.NODESET);
        } catch (XPathExpressionException e) {
            throw new IllegalStateException("Invalid test-case query", e);
        }

        List<TestCaseOutcome> outcomes = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            outcomes.add(toOutcome((Element) nodes.item(i)));
        }
        log.debug("Parsed {} test case record(s) from {}", outcomes.size(), sourceName);
        return outcomes;
    }

    private static TestCaseOutcome toOutcome(Element testCase) {
        String message = "";
        String stackTrace = "";
        Element failure = firstChild(testCase, "failure");
        Element reason = firstChild(testCase, "reason");
        if (failure != null) {
            message = childText(failure, "message");
            stackTrace = childText(failure, "stack-trace");
        } else if (reason != null) {
            message = childText(reason, "message");
        }
        String name = testCase.getAttribute("name");
        String fullName = testCase.getAttribute("fullname");
        if (name.isBlank() && fullName.isBlank()) {
            throw new ResultArtifactException("test-case record has neither name nor fullname");
        }
        return new TestCaseOutcome(
                testCase.getAttribute("id"),
                name,
                fullName.isBlank() ? null : fullName,
                testCase.getAttribute("result"),
                testCase.getAttribute("label"),
                parseDuration(testCase.getAttribute("duration")),
                childText(testCase, "output"),
                message,
                stackTrace);
    }

    static Duration parseDuration(String seconds) {
        if (seconds == null || seconds.isBlank()) {
            return Duration.ZERO;
        }
        try {
            return Duration.ofNanos(Math.round(Double.parseDouble(seconds.trim()) * 1_000_000_000d));
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable duration '{}'", seconds);
            return Duration.ZERO;
        }
    }

    private static Element firstChild(Element parent, String name) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && name.equals(n.getNodeName())) {
                return (Element) n;
            }
        }
        return null;
    }

    private static String childText(Element parent, String name) {
        Element child = firstChild(parent, name);
        return child == null ? "" : child.getTextContent().strip();
    }

    private static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure configuration", e);
        }
    }
}
