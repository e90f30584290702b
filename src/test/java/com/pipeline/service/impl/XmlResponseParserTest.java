package com.pipeline.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static com.pipeline.TestJson.json;
import static org.assertj.core.api.Assertions.assertThat;

class XmlResponseParserTest {

    @Test
    void parse_shouldReturnRootContentWithRepeatedTagsAsLists() {
        String body = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<response><header><resultCode>00</resultCode></header>"
                + "<body><items><item><name> A </name></item><item><name>B</name></item></items>"
                + "<totalCount>2</totalCount></body></response>";

        JsonNode parsed = XmlResponseParser.parse(body);

        assertThat(parsed).isEqualTo(json("{'header': {'resultCode': '00'},"
                + " 'body': {'items': {'item': [{'name': 'A'}, {'name': 'B'}]}, 'totalCount': '2'}}"));
    }

    @Test
    void parse_shouldCollectAttributesAndDropNamespaces() {
        String body = "<feed xmlns=\"http://www.w3.org/2005/Atom\" xmlns:x=\"urn:x\" version=\"2\">"
                + "<x:entry x:id=\"7\"><title>T</title></x:entry><empty/></feed>";

        JsonNode parsed = XmlResponseParser.parse(body);

        assertThat(parsed).isEqualTo(json("{'@attributes': {'version': '2'},"
                + " 'entry': {'@attributes': {'id': '7'}, 'title': 'T'}, 'empty': {}}"));
    }

    @Test
    void parse_shouldReturnTextForTextOnlyRoot() {
        assertThat(XmlResponseParser.parse("<message>  OK  </message>")).isEqualTo(json("'OK'"));
    }

    @Test
    void parse_shouldKeepMalformedBodyAsRawText() {
        String body = "<response><unclosed></response>";

        assertThat(XmlResponseParser.parse(body)).isEqualTo(json("{'raw_text': '<response><unclosed></response>'}"));
    }

    @Test
    void parse_shouldRejectDoctypeDeclarations() {
        String body = "<!DOCTYPE r [<!ENTITY e SYSTEM \"file:///etc/passwd\">]><r>&e;</r>";

        assertThat(XmlResponseParser.parse(body).has("raw_text")).isTrue();
    }
}
