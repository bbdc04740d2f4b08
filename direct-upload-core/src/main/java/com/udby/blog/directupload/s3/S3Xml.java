/*
Copyright 2025 Jesper Udby

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package com.udby.blog.directupload.s3;

import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Builds the few request bodies the store needs and reads values out of its responses.
 */
final class S3Xml {
    private static final DocumentBuilderFactory DOCUMENT_BUILDER_FACTORY = newDocumentBuilderFactory();

    private S3Xml() {
    }

    /**
     * Body of a complete multipart upload request. The store requires ascending part numbers, so parts are sorted here
     * whatever order the caller collected them in.
     */
    static String completeMultipartUpload(Collection<? extends StorageFacility.UploadedPart> parts) {
        final var sb = new StringBuilder(64 + parts.size() * 96);
        sb.append("<CompleteMultipartUpload xmlns=\"http://s3.amazonaws.com/doc/2006-03-01/\">");
        parts.stream()
                .sorted(Comparator.comparingInt(StorageFacility.UploadedPart::partNumber))
                .forEach(part -> sb.append("<Part><PartNumber>")
                        .append(part.partNumber())
                        .append("</PartNumber><ETag>")
                        .append(escape(part.eTag()))
                        .append("</ETag></Part>"));
        sb.append("</CompleteMultipartUpload>");
        return sb.toString();
    }

    /**
     * @param body XML document
     * @param tag  element name
     * @return text of the first element with that name, if any
     */
    static Optional<String> firstText(byte[] body, String tag) throws IOException {
        final var nodes = parse(body).getElementsByTagName(tag);
        if (nodes.getLength() == 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes.item(0).getTextContent());
    }

    /**
     * @return true if the document root is an S3 {@code <Error>} element
     */
    static boolean isErrorDocument(byte[] body) {
        if (body.length == 0) {
            return false;
        }
        try {
            final var root = parse(body).getDocumentElement();
            return root != null && "Error".equals(root.getLocalName() == null ? root.getNodeName() : root.getLocalName());
        } catch (IOException e) {
            return false;
        }
    }

    static String escape(String value) {
        final var sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&apos;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static Document parse(byte[] body) throws IOException {
        try {
            return DOCUMENT_BUILDER_FACTORY.newDocumentBuilder().parse(new ByteArrayInputStream(body));
        } catch (ParserConfigurationException | SAXException e) {
            throw new IOException("Unparseable XML response", e);
        }
    }

    private static DocumentBuilderFactory newDocumentBuilderFactory() {
        try {
            final var factory = DocumentBuilderFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setNamespaceAware(true);
            return factory;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser not available", e);
        }
    }
}
