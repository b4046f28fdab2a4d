/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.apache.ripcord.codec;

import org.apache.commons.lang3.StringUtils;
import org.apache.ripcord.exception.CodecException;
import org.apache.ripcord.exception.ConfigurationException;
import org.apache.ripcord.value.Base64Value;
import org.apache.ripcord.value.DateTimeValue;
import org.apache.ripcord.value.Fault;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The XML-RPC codec.
 *
 * <p>Besides the types of the XML-RPC specification it reads and writes the common {@code <nil/>} and
 * {@code <i8>} extensions.
 */
public final class XmlRpcCodec implements RpcCodec {

    private static final String METHOD_CALL = "methodCall";
    private static final String METHOD_RESPONSE = "methodResponse";
    private static final String METHOD_NAME = "methodName";
    private static final String PARAMS = "params";
    private static final String PARAM = "param";
    private static final String VALUE = "value";
    private static final String FAULT = "fault";

    private final DocumentBuilderFactory factory;

    public XmlRpcCodec() {
        try {
            factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
        } catch (ParserConfigurationException | RuntimeException e) {
            throw new ConfigurationException("XML parser is not available", e);
        }
    }

    /**
     * Returns a codec able to speak the dialect selected by the options.
     *
     * @param options the output options
     * @return the codec
     * @throws ConfigurationException if no codec is available for the dialect
     */
    public static RpcCodec forOptions(OutputOptions options) {
        return switch (options.version()) {
            case XMLRPC, AUTO -> new XmlRpcCodec();
            default -> throw new ConfigurationException(
                    "No codec available for protocol version " + options.version().optionValue());
        };
    }

    @Override
    public byte[] encodeRequest(String methodName, List<?> params, OutputOptions options) {
        XmlRpcWriter writer = new XmlRpcWriter(options)
                .open(METHOD_CALL)
                .element(METHOD_NAME, methodName)
                .open(PARAMS);
        for (Object param : params) {
            writer.open(PARAM).value(param).close(PARAM);
        }
        writer.close(PARAMS).close(METHOD_CALL);
        return writer.toXml().getBytes(options.encoding());
    }

    @Override
    public RpcRequest decodeRequest(byte[] payload) {
        Element root = parse(payload, METHOD_CALL);
        Element nameElement = firstChild(root, METHOD_NAME);
        if (nameElement == null || StringUtils.isBlank(nameElement.getTextContent())) {
            throw new CodecException("Missing methodName in methodCall");
        }
        return new RpcRequest(nameElement.getTextContent().trim(), readParams(root));
    }

    @Override
    public byte[] encodeResponse(Object value, OutputOptions options) {
        XmlRpcWriter writer = new XmlRpcWriter(options).open(METHOD_RESPONSE);
        if (value instanceof Fault fault) {
            writer.open(FAULT).value(fault).close(FAULT);
        } else {
            writer.open(PARAMS).open(PARAM).value(value).close(PARAM).close(PARAMS);
        }
        writer.close(METHOD_RESPONSE);
        return writer.toXml().getBytes(options.encoding());
    }

    @Override
    public Object decodeResponse(byte[] payload) {
        Element root = parse(payload, METHOD_RESPONSE);
        Element fault = firstChild(root, FAULT);
        if (fault != null) {
            Object value = readValue(requireChild(fault, VALUE));
            if (!Fault.isFault(value)) {
                throw new CodecException("Malformed fault in methodResponse");
            }
            return Fault.from(value);
        }
        List<Object> params = readParams(root);
        return params.isEmpty() ? null : params.get(0);
    }

    private Element parse(byte[] payload, String rootName) {
        if (payload == null || payload.length == 0) {
            throw new CodecException("Empty payload");
        }
        Document document;
        try {
            DocumentBuilder builder;
            synchronized (factory) {
                builder = factory.newDocumentBuilder();
            }
            document = builder.parse(new ByteArrayInputStream(payload));
        } catch (SAXException | IOException e) {
            throw new CodecException("Cannot parse payload: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new ConfigurationException("XML parser is not available", e);
        }
        Element root = document.getDocumentElement();
        if (!rootName.equals(localName(root))) {
            throw new CodecException("Expected " + rootName + " but found " + localName(root));
        }
        return root;
    }

    private List<Object> readParams(Element root) {
        List<Object> params = new ArrayList<>();
        Element paramsElement = firstChild(root, PARAMS);
        if (paramsElement == null) {
            return params;
        }
        for (Element param : children(paramsElement, PARAM)) {
            params.add(readValue(requireChild(param, VALUE)));
        }
        return params;
    }

    private Object readValue(Element value) {
        Element typed = firstChild(value, null);
        if (typed == null) {
            return value.getTextContent();
        }
        String text = typed.getTextContent();
        String type = localName(typed);
        try {
            return switch (type) {
                case "i4", "int" -> Integer.valueOf(text.trim());
                case "i8" -> Long.valueOf(text.trim());
                case "boolean" -> parseBoolean(text.trim());
                case "string" -> text;
                case "double" -> Double.valueOf(text.trim());
                case "dateTime.iso8601" -> new DateTimeValue(text);
                case "base64" -> Base64Value.fromEncoded(text);
                case "nil" -> null;
                case "struct" -> readStruct(typed);
                case "array" -> readArray(typed);
                default -> throw new CodecException("Unknown value type " + type);
            };
        } catch (IllegalArgumentException e) {
            throw new CodecException("Invalid " + type + " value: " + text, e);
        }
    }

    private Map<String, Object> readStruct(Element struct) {
        Map<String, Object> members = new LinkedHashMap<>();
        for (Element member : children(struct, "member")) {
            Element name = requireChild(member, "name");
            members.put(name.getTextContent().trim(), readValue(requireChild(member, VALUE)));
        }
        return members;
    }

    private List<Object> readArray(Element array) {
        List<Object> values = new ArrayList<>();
        Element data = firstChild(array, "data");
        if (data == null) {
            return values;
        }
        for (Element value : children(data, VALUE)) {
            values.add(readValue(value));
        }
        return values;
    }

    private static Boolean parseBoolean(String text) {
        return switch (text) {
            case "1", "true" -> Boolean.TRUE;
            case "0", "false" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("Not a boolean: " + text);
        };
    }

    private static Element requireChild(Element parent, String name) {
        Element child = firstChild(parent, name);
        if (child == null) {
            throw new CodecException("Missing " + name + " in " + localName(parent));
        }
        return child;
    }

    private static Element firstChild(Element parent, String name) {
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element && (name == null || name.equals(localName(element)))) {
                return element;
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String name) {
        List<Element> elements = new ArrayList<>();
        for (Node node = parent.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element && name.equals(localName(element))) {
                elements.add(element);
            }
        }
        return elements;
    }

    private static String localName(Element element) {
        return StringUtils.substringAfterLast(":" + element.getTagName(), ":");
    }
}
