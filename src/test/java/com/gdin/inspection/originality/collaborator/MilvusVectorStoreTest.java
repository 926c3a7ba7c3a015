package com.gdin.inspection.originality.collaborator;

import com.gdin.inspection.originality.models.ContentKind;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@Slf4j
public class MilvusVectorStoreTest {

    @Test
    public void testFilterExcludesAuthorAndSubmissionOfSameKind() {
        SearchFilter filter = SearchFilter.builder()
                .contentKind(ContentKind.CODE)
                .excludeAuthorId("20231104")
                .excludeSubmissionId("2026-ds-hw3-0042")
                .build();

        String expr = MilvusVectorStore.toFilterExpression(filter);
        log.info("filter: {}", expr);
        assertEquals("content_kind == \"code\" && author_id != \"20231104\""
                + " && submission_id != \"2026-ds-hw3-0042\"", expr);
    }

    @Test
    public void testFilterValuesAreQuoted() {
        SearchFilter filter = SearchFilter.builder()
                .contentKind(ContentKind.NATURAL_LANGUAGE)
                .excludeAuthorId("o\"brien")
                .excludeSubmissionId("a\\b")
                .build();

        assertEquals("content_kind == \"natural_language\" && author_id != \"o\\\"brien\""
                + " && submission_id != \"a\\\\b\"", MilvusVectorStore.toFilterExpression(filter));
    }

    @Test
    public void testBlankExclusionsAreOmitted() {
        SearchFilter kindOnly = SearchFilter.builder()
                .contentKind(ContentKind.UNKNOWN)
                .excludeAuthorId(" ")
                .build();
        assertEquals("content_kind == \"unknown\"", MilvusVectorStore.toFilterExpression(kindOnly));
        assertEquals("", MilvusVectorStore.toFilterExpression(SearchFilter.builder().build()));
        assertNull(MilvusVectorStore.toFilterExpression(null));
    }
}
