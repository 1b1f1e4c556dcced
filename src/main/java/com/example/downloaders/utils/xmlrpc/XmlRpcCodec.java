package com.example.downloaders.utils.xmlrpc;

import com.example.downloaders.exception.DownloaderException;
import com.example.downloaders.exception.XmlRpcFaultException;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal XML-RPC request writer and response reader.
 * <p>
 * The reader is a small recursive-descent parser over the raw text. It knows
 * exactly the element vocabulary of XML-RPC and nothing else, which is all the
 * rTorrent and NZBGet endpoints ever send. No DTDs, no entities beyond the
 * predefined five and numeric references.
 */
public final class XmlRpcCodec {

    static final int MAX_DEPTH = 64;

    private XmlRpcCodec() {}

    public static String encodeCall(String methodName, List<?> params) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("<?xml version=\"1.0\"?>\n<methodCall>\n<methodName>")
                .append(escape(methodName))
                .append("</methodName>\n<params>\n");
        for (Object param : params) {
            sb.append("<param><value>");
            encodeValue(XmlRpcValue.of(param), sb);
            sb.append("</value></param>\n");
        }
        sb.append("</params>\n</methodCall>");
        return sb.toString();
    }

    static void encodeValue(XmlRpcValue value, StringBuilder sb) {
        switch (value.getType()) {
            case STRING:
                sb.append("<string>").append(escape(value.asString())).append("</string>");
                break;
            case INT:
                sb.append("<int>").append(value.asLong()).append("</int>");
                break;
            case I8:
                sb.append("<i8>").append(value.asLong()).append("</i8>");
                break;
            case BOOLEAN:
                sb.append("<boolean>").append(value.asBoolean() ? 1 : 0).append("</boolean>");
                break;
            case DOUBLE:
                sb.append("<double>").append(value.asDouble()).append("</double>");
                break;
            case BASE64:
                sb.append("<base64>").append(Base64.getEncoder().encodeToString(value.asBytes())).append("</base64>");
                break;
            case ARRAY:
                sb.append("<array><data>");
                for (XmlRpcValue item : value.asList()) {
                    sb.append("<value>");
                    encodeValue(item, sb);
                    sb.append("</value>");
                }
                sb.append("</data></array>");
                break;
            case STRUCT:
                sb.append("<struct>");
                for (Map.Entry<String, XmlRpcValue> member : value.asMap().entrySet()) {
                    sb.append("<member><name>").append(escape(member.getKey())).append("</name><value>");
                    encodeValue(member.getValue(), sb);
                    sb.append("</value></member>");
                }
                sb.append("</struct>");
                break;
            default:
                sb.append("<nil/>");
        }
    }

    /**
     * Parses a {@code methodResponse}.
     *
     * @return the single result value, or nil when the response has no params
     * @throws XmlRpcFaultException when the response is a fault
     * @throws DownloaderException  when the body is not a well-formed response
     */
    public static XmlRpcValue decodeResponse(String xml) throws DownloaderException {
        if (xml == null || xml.isBlank()) {
            throw DownloaderException.protocol("Empty XML-RPC response");
        }
        return new Parser(xml).parseResponse();
    }

    public static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '"': sb.append("&quot;"); break;
                case '\'': sb.append("&apos;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String unescape(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int semi = c == '&' ? text.indexOf(';', i) : -1;
            if (semi < 0) {
                sb.append(c);
                i++;
                continue;
            }
            String entity = text.substring(i + 1, semi);
            String decoded = decodeEntity(entity);
            if (decoded == null) {
                sb.append(c);
                i++;
            } else {
                sb.append(decoded);
                i = semi + 1;
            }
        }
        return sb.toString();
    }

    private static String decodeEntity(String entity) {
        switch (entity) {
            case "lt": return "<";
            case "gt": return ">";
            case "amp": return "&";
            case "quot": return "\"";
            case "apos": return "'";
            default:
                break;
        }
        try {
            if (entity.startsWith("#x") || entity.startsWith("#X")) {
                return new String(Character.toChars(Integer.parseInt(entity.substring(2), 16)));
            }
            if (entity.startsWith("#")) {
                return new String(Character.toChars(Integer.parseInt(entity.substring(1))));
            }
        } catch (IllegalArgumentException e) {
            return null;
        }
        return null;
    }

    // ---- parser -----------------------------------------------------------

    private static final class Parser {
        private final String xml;
        private int pos;
        private int depth;

        Parser(String xml) {
            this.xml = xml;
        }

        XmlRpcValue parseResponse() throws DownloaderException {
            skipMisc();
            expectOpen("methodResponse");
            skipMisc();
            if (tryOpen("fault")) {
                skipMisc();
                expectOpen("value");
                XmlRpcValue fault = parseValue();
                throw new XmlRpcFaultException(fault.get("faultCode").asInt(), fault.get("faultString").asString());
            }
            if (trySelfClosing("params")) {
                return XmlRpcValue.nil();
            }
            expectOpen("params");
            skipMisc();
            if (lookingAt("</params>")) {
                return XmlRpcValue.nil();
            }
            expectOpen("param");
            skipMisc();
            expectOpen("value");
            return parseValue();
        }

        /** Called just after {@code <value>}; consumes up to and including {@code </value>}. */
        private XmlRpcValue parseValue() throws DownloaderException {
            if (++depth > MAX_DEPTH) {
                throw malformed("nesting deeper than " + MAX_DEPTH);
            }
            try {
                int textStart = pos;
                skipWhitespace();
                if (lookingAt("</value>")) {
                    // untyped value is a string, whitespace included
                    String text = xml.substring(textStart, pos);
                    pos += "</value>".length();
                    return XmlRpcValue.string(unescape(text));
                }
                if (!lookingAt("<")) {
                    pos = textStart;
                    String text = readTextUntil("</value>");
                    return XmlRpcValue.string(unescape(text));
                }
                XmlRpcValue result = parseTyped();
                skipWhitespace();
                expect("</value>");
                return result;
            } finally {
                depth--;
            }
        }

        private XmlRpcValue parseTyped() throws DownloaderException {
            int tagStart = pos;
            String tag = readOpenTag();
            boolean selfClosing = xml.charAt(pos - 2) == '/';
            if (selfClosing) {
                switch (tag) {
                    case "nil":
                    case "ex:nil":
                        return XmlRpcValue.nil();
                    case "string":
                        return XmlRpcValue.string("");
                    case "array":
                        return XmlRpcValue.array(List.of());
                    case "struct":
                        return XmlRpcValue.struct(Map.of());
                    default:
                        pos = tagStart;
                        throw malformed("empty <" + tag + "/>");
                }
            }
            switch (tag) {
                case "string":
                    return XmlRpcValue.string(unescape(readTextUntil("</string>")));
                case "int":
                case "i4":
                    return XmlRpcValue.of(parseLong(readTextUntil("</" + tag + ">")));
                case "i8":
                case "ex:i8":
                    return XmlRpcValue.i8(parseLong(readTextUntil("</" + tag + ">")));
                case "boolean":
                    return XmlRpcValue.bool("1".equals(readTextUntil("</boolean>").trim()));
                case "double":
                    return XmlRpcValue.dbl(parseDouble(readTextUntil("</double>")));
                case "base64":
                    return XmlRpcValue.base64(decodeBase64(readTextUntil("</base64>")));
                case "dateTime.iso8601":
                    return XmlRpcValue.string(readTextUntil("</dateTime.iso8601>").trim());
                case "nil":
                case "ex:nil":
                    readTextUntil("</" + tag + ">");
                    return XmlRpcValue.nil();
                case "array":
                    return parseArray();
                case "struct":
                    return parseStruct();
                default:
                    throw malformed("unknown value type <" + tag + ">");
            }
        }

        private XmlRpcValue parseArray() throws DownloaderException {
            List<XmlRpcValue> items = new ArrayList<>();
            skipWhitespace();
            if (trySelfClosing("data")) {
                skipWhitespace();
                expect("</array>");
                return XmlRpcValue.array(items);
            }
            expectOpen("data");
            while (true) {
                skipWhitespace();
                if (lookingAt("</data>")) {
                    pos += "</data>".length();
                    break;
                }
                expectOpen("value");
                items.add(parseValue());
            }
            skipWhitespace();
            expect("</array>");
            return XmlRpcValue.array(items);
        }

        private XmlRpcValue parseStruct() throws DownloaderException {
            Map<String, XmlRpcValue> members = new LinkedHashMap<>();
            while (true) {
                skipWhitespace();
                if (lookingAt("</struct>")) {
                    pos += "</struct>".length();
                    return XmlRpcValue.struct(members);
                }
                expectOpen("member");
                String name = null;
                XmlRpcValue value = null;
                for (int i = 0; i < 2; i++) {
                    skipWhitespace();
                    if (tryOpen("name")) {
                        name = unescape(readTextUntil("</name>"));
                    } else {
                        expectOpen("value");
                        value = parseValue();
                    }
                }
                skipWhitespace();
                expect("</member>");
                if (name == null || value == null) {
                    throw malformed("struct member without name or value");
                }
                members.put(name, value);
            }
        }

        // ---- lexical helpers ----------------------------------------------

        /** Skips whitespace, the XML declaration and comments. */
        private void skipMisc() {
            while (true) {
                skipWhitespace();
                if (lookingAt("<?")) {
                    int end = xml.indexOf("?>", pos);
                    pos = end < 0 ? xml.length() : end + 2;
                } else if (lookingAt("<!--")) {
                    int end = xml.indexOf("-->", pos);
                    pos = end < 0 ? xml.length() : end + 3;
                } else {
                    return;
                }
            }
        }

        private void skipWhitespace() {
            while (pos < xml.length() && Character.isWhitespace(xml.charAt(pos))) {
                pos++;
            }
        }

        private boolean lookingAt(String token) {
            return xml.startsWith(token, pos);
        }

        private void expect(String token) throws DownloaderException {
            if (!lookingAt(token)) {
                throw malformed("expected " + token);
            }
            pos += token.length();
        }

        private void expectOpen(String tag) throws DownloaderException {
            if (!tryOpen(tag)) {
                throw malformed("expected <" + tag + ">");
            }
        }

        /** Consumes {@code <tag>} or {@code <tag attr="...">} if present. */
        private boolean tryOpen(String tag) {
            String prefix = "<" + tag;
            if (!lookingAt(prefix)) {
                return false;
            }
            int after = pos + prefix.length();
            if (after >= xml.length()) {
                return false;
            }
            char next = xml.charAt(after);
            if (next != '>' && !Character.isWhitespace(next)) {
                return false;
            }
            int close = xml.indexOf('>', after);
            if (close < 0 || xml.charAt(close - 1) == '/') {
                return false;
            }
            pos = close + 1;
            return true;
        }

        private boolean trySelfClosing(String tag) {
            String token = "<" + tag + "/>";
            if (lookingAt(token)) {
                pos += token.length();
                return true;
            }
            token = "<" + tag + " />";
            if (lookingAt(token)) {
                pos += token.length();
                return true;
            }
            return false;
        }

        /** Reads {@code <name ...>} or {@code <name/>} and returns the name. */
        private String readOpenTag() throws DownloaderException {
            if (!lookingAt("<") || lookingAt("</")) {
                throw malformed("expected an element");
            }
            int close = xml.indexOf('>', pos);
            if (close < 0) {
                throw malformed("unterminated element");
            }
            String inner = xml.substring(pos + 1, close).trim();
            if (inner.endsWith("/")) {
                inner = inner.substring(0, inner.length() - 1).trim();
            }
            int space = indexOfWhitespace(inner);
            pos = close + 1;
            return space < 0 ? inner : inner.substring(0, space);
        }

        private String readTextUntil(String closing) throws DownloaderException {
            int end = xml.indexOf(closing, pos);
            if (end < 0) {
                throw malformed("missing " + closing);
            }
            String text = xml.substring(pos, end);
            pos = end + closing.length();
            return text;
        }

        private long parseLong(String text) throws DownloaderException {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw malformed("invalid integer '" + text.trim() + "'");
            }
        }

        private double parseDouble(String text) throws DownloaderException {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw malformed("invalid double '" + text.trim() + "'");
            }
        }

        private byte[] decodeBase64(String text) throws DownloaderException {
            try {
                return Base64.getMimeDecoder().decode(text.trim());
            } catch (IllegalArgumentException e) {
                throw malformed("invalid base64");
            }
        }

        private DownloaderException malformed(String detail) {
            return DownloaderException.protocol("Malformed XML-RPC response at offset " + pos + ": " + detail);
        }

        private static int indexOfWhitespace(String s) {
            for (int i = 0; i < s.length(); i++) {
                if (Character.isWhitespace(s.charAt(i))) {
                    return i;
                }
            }
            return -1;
        }
    }
}
