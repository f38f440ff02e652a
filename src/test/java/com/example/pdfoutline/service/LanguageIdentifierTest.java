package com.example.pdfoutline.service;

import com.example.pdfoutline.SpanFixtures;
import com.example.pdfoutline.model.ScriptProfile;
import com.example.pdfoutline.model.TextSpan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LanguageIdentifier")
class LanguageIdentifierTest {

    private final LanguageIdentifier identifier = new LanguageIdentifier();

    private static List<TextSpan> spans(String... texts) {
        TextSpan[] result = new TextSpan[texts.length];
        for (int i = 0; i < texts.length; i++) {
            result[i] = SpanFixtures.span(texts[i], 11f, false, 1, 72 + i * 15);
        }
        return List.of(result);
    }

    @Test
    @DisplayName("Picks the script with the most characters")
    void majorityScript() {
        assertThat(identifier.identify(spans("Chapter one", "The quick brown fox"))).isEqualTo(ScriptProfile.LATIN);
        assertThat(identifier.identify(spans("अध्याय 1", "यह एक परीक्षण दस्तावेज़ है"))).isEqualTo(ScriptProfile.DEVANAGARI);
        assertThat(identifier.identify(spans("第1章 概要", "本書の目的について"))).isEqualTo(ScriptProfile.CJK);
        assertThat(identifier.identify(spans("제1장 서론", "이 문서는 시스템을 설명합니다"))).isEqualTo(ScriptProfile.HANGUL);
        assertThat(identifier.identify(spans("الفصل الأول", "مقدمة عن النظام"))).isEqualTo(ScriptProfile.ARABIC);
    }

    @Test
    @DisplayName("Kana counts towards CJK")
    void kanaIsCjk() {
        assertThat(identifier.identify(spans("はじめに", "カタカナ"))).isEqualTo(ScriptProfile.CJK);
    }

    @Test
    @DisplayName("Mixed documents follow the majority, with English terms inside")
    void mixedDocument() {
        assertThat(identifier.identify(spans("API 設計の基本方針とシステム構成について説明する"))).isEqualTo(ScriptProfile.CJK);
    }

    @Test
    @DisplayName("Ties and empty input resolve to LATIN")
    void tiesAndEmpty() {
        assertThat(identifier.identify(Collections.emptyList())).isEqualTo(ScriptProfile.LATIN);
        assertThat(identifier.identify(spans("   "))).isEqualTo(ScriptProfile.LATIN);
        assertThat(identifier.identify(spans("ab", "漢字"))).isEqualTo(ScriptProfile.LATIN);
    }
}
