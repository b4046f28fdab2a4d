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

import org.apache.ripcord.exception.CodecException;
import org.apache.ripcord.value.Base64Value;
import org.apache.ripcord.value.DateTimeValue;
import org.apache.ripcord.value.Fault;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * Writes XML-RPC documents honouring the verbosity and escaping output options.
 */
final class XmlRpcWriter {

    private static final String INDENT = " ";

    private final StringBuilder out = new StringBuilder();
    private final OutputOptions options;
    private int depth;

    XmlRpcWriter(OutputOptions options) {
        this.options = options;
        out.append("<?xml version=\"1.0\" encoding=\"")
                .append(options.encoding().name().toLowerCase())
                .append("\"?>");
        newline();
    }

    XmlRpcWriter open(String tag) {
        indent();
        out.append('<').append(tag).append('>');
        depth++;
        newline();
        return this;
    }

    XmlRpcWriter close(String tag) {
        depth--;
        indent();
        out.append("</").append(tag).append('>');
        newline();
        return this;
    }

    XmlRpcWriter element(String tag, String text) {
        indent();
        writeElement(tag, text);
        newline();
        return this;
    }

    XmlRpcWriter value(Object value) {
        indent();
        out.append("<value>");
        if (isScalar(value)) {
            writeScalar(value);
            out.append("</value>");
            newline();
            return this;
        }
        depth++;
        newline();
        if (value instanceof Fault fault) {
            writeStruct(fault.toMap());
        } else if (value instanceof Map<?, ?> map) {
            writeStruct(map);
        } else if (value instanceof Collection<?> values) {
            writeArray(values.toArray());
        } else if (value instanceof Object[] values) {
            writeArray(values);
        } else {
            throw new CodecException("Cannot encode value of type " + value.getClass().getName());
        }
        depth--;
        indent();
        out.append("</value>");
        newline();
        return this;
    }

    String toXml() {
        return out.toString();
    }

    private void writeStruct(Map<?, ?> map) {
        open("struct");
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            open("member");
            element("name", String.valueOf(entry.getKey()));
            value(entry.getValue());
            close("member");
        }
        close("struct");
    }

    private void writeArray(Object[] values) {
        open("array");
        open("data");
        for (Object item : values) {
            value(item);
        }
        close("data");
        close("array");
    }

    private static boolean isScalar(Object value) {
        return value == null
                || value instanceof CharSequence
                || value instanceof Character
                || value instanceof Enum<?>
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof DateTimeValue
                || value instanceof Instant
                || value instanceof Base64Value
                || value instanceof byte[];
    }

    private void writeScalar(Object value) {
        if (value == null) {
            out.append("<nil/>");
        } else if (value instanceof CharSequence || value instanceof Character) {
            writeElement("string", value.toString());
        } else if (value instanceof Enum<?> e) {
            writeElement("string", e.name());
        } else if (value instanceof Boolean b) {
            writeElement("boolean", b ? "1" : "0");
        } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            writeElement("int", value.toString());
        } else if (value instanceof Long l) {
            writeElement(l == l.intValue() ? "int" : "i8", l.toString());
        } else if (value instanceof BigInteger big) {
            if (big.bitLength() >= Long.SIZE) {
                throw new CodecException("Integer value out of range: " + big);
            }
            writeElement(big.bitLength() < Integer.SIZE ? "int" : "i8", big.toString());
        } else if (value instanceof Number number) {
            writeElement("double", formatDouble(number));
        } else if (value instanceof DateTimeValue dateTime) {
            writeElement("dateTime.iso8601", dateTime.iso8601());
        } else if (value instanceof Instant instant) {
            writeElement("dateTime.iso8601", DateTimeValue.of(instant).iso8601());
        } else if (value instanceof Base64Value blob) {
            writeElement("base64", blob.encoded());
        } else {
            writeElement("base64", new Base64Value((byte[]) value).encoded());
        }
    }

    private static String formatDouble(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        double d = number.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new CodecException("Cannot encode non-finite double " + d);
        }
        return BigDecimal.valueOf(d).toPlainString();
    }

    private void writeElement(String tag, String text) {
        out.append('<').append(tag).append('>');
        appendText(text);
        out.append("</").append(tag).append('>');
    }

    private void appendText(String text) {
        if (options.escapes(Escaping.CDATA)) {
            out.append("<![CDATA[").append(text.replace("]]>", "]]]]><![CDATA[>")).append("]]>");
            return;
        }
        boolean markup = options.escapes(Escaping.MARKUP);
        boolean nonAscii = options.escapes(Escaping.NON_ASCII);
        boolean nonPrint = options.escapes(Escaping.NON_PRINT);
        text.codePoints().forEach(cp -> {
            if (markup && cp == '&') {
                out.append("&amp;");
            } else if (markup && cp == '<') {
                out.append("&lt;");
            } else if (markup && cp == '>') {
                out.append("&gt;");
            } else if (markup && cp == '"') {
                out.append("&quot;");
            } else if (nonAscii && cp > 127) {
                out.append("&#").append(cp).append(';');
            } else if (nonPrint && cp < 32 && cp != '\t' && cp != '\n' && cp != '\r') {
                out.append("&#").append(cp).append(';');
            } else {
                out.appendCodePoint(cp);
            }
        });
    }

    private void indent() {
        if (options.verbosity() == Verbosity.PRETTY) {
            out.append(INDENT.repeat(depth));
        }
    }

    private void newline() {
        if (options.verbosity() != Verbosity.NO_WHITE_SPACE) {
            out.append('\n');
        }
    }
}
