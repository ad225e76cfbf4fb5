package com.recipick.matching;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MaterialNormalizerTest {

    @Test
    void normalize_should_prefer_longest_key_when_keys_overlap() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("삼겹", "pork");
        mapping.put("냉동삼겹살", "frozen_pork");

        MaterialNormalizer normalizer = MaterialNormalizer.build(mapping);

        assertThat(normalizer.normalize(List.of("냉동삼겹살 1개"))).containsExactly("frozen_pork");
    }

    @Test
    void normalize_should_still_match_shorter_key_outside_longer_span() {
        MaterialNormalizer normalizer = MaterialNormalizer.build(Map.of(
            "삼겹", "pork",
            "냉동삼겹살", "frozen_pork"
        ));

        assertThat(normalizer.normalize(List.of("냉동삼겹살 삼겹 특가")))
            .containsExactlyInAnyOrder("frozen_pork", "pork");
    }

    @Test
    void normalize_should_collect_every_occurrence_and_fold_many_to_one() {
        MaterialNormalizer normalizer = MaterialNormalizer.build(Map.of(
            "포기김치", "김치",
            "종가집김치", "김치",
            "풀무원두부", "두부",
            "대파", "대파"
        ));

        assertThat(normalizer.normalize(List.of(
            "  종가집김치 1kg  6,900",
            "풀무원두부 300g 대파 1단",
            "포기김치"
        ))).containsExactlyInAnyOrder("김치", "두부", "대파");
    }

    @Test
    void normalize_should_skip_blank_null_and_unrecognized_lines() {
        MaterialNormalizer normalizer = MaterialNormalizer.build(Map.of("우유", "우유"));

        List<String> lines = new ArrayList<>(Arrays.asList("", "   ", null, "봉투값 100원", "서울 우유 1L"));

        assertThat(normalizer.normalize(lines)).containsExactly("우유");
    }

    @Test
    void normalize_should_be_idempotent_and_ignore_line_order() {
        MaterialNormalizer normalizer = MaterialNormalizer.build(Map.of(
            "계란", "계란",
            "양파", "양파",
            "두부", "두부"
        ));
        List<String> lines = List.of("계란 30구", "깐양파 1망", "두부");
        List<String> reversed = new ArrayList<>(lines);
        Collections.reverse(reversed);

        assertThat(normalizer.normalize(lines)).isEqualTo(normalizer.normalize(lines));
        assertThat(normalizer.normalize(reversed)).isEqualTo(normalizer.normalize(lines));
    }

    @Test
    void normalize_should_treat_keys_literally() {
        MaterialNormalizer normalizer = MaterialNormalizer.build(Map.of("C++ 소스(매운맛)", "소스"));

        assertThat(normalizer.normalize(List.of("C++ 소스(매운맛) 1병"))).containsExactly("소스");
        assertThat(normalizer.normalize(List.of("C 소스매운맛"))).isEmpty();
    }

    @Test
    void normalize_should_return_empty_set_for_empty_mapping() {
        MaterialNormalizer normalizer = MaterialNormalizer.build(Map.of());

        assertThat(normalizer.normalize(List.of("김치", "두부"))).isEmpty();
        assertThat(normalizer.size()).isZero();
    }

    @Test
    void build_should_ignore_blank_keys() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("", "nothing");
        mapping.put("두부", "두부");

        MaterialNormalizer normalizer = MaterialNormalizer.build(mapping);

        assertThat(normalizer.size()).isEqualTo(1);
        assertThat(normalizer.normalize(List.of("아무거나", "두부 한모"))).containsExactly("두부");
    }
}
