package com.work.almanac.indexer.service.message;

import com.work.almanac.core.model.ProcessorPolicy;
import com.work.almanac.core.repository.entity.ProcessorEntity;
import com.work.almanac.core.store.MessageRepository;
import com.work.almanac.indexer.config.IndexerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.*;

public class ProcessorPolicyResolverTest {

    private MessageRepository repository;
    private ProcessorPolicyResolver resolver;

    @BeforeEach
    public void setUp() {
        repository = mock(MessageRepository.class);
        IndexerProperties props = new IndexerProperties();
        props.getMessages().setDefaultTimeoutBlocks(500L);
        resolver = new ProcessorPolicyResolver(repository, props);
    }

    private ProcessorEntity processor(boolean paused, Integer maxRetry) {
        ProcessorEntity p = new ProcessorEntity();
        p.setId("eth:0xp");
        p.setPaused(paused);
        p.setMaxRetryCount(maxRetry);
        return p;
    }

    @Test
    public void processor_fields_override_defaults() {
        when(repository.findProcessor("eth:0xp")).thenReturn(processor(false, 7));

        ProcessorPolicy policy = resolver.policyFor("eth:0xp");

        assertEquals(7, policy.getMaxRetryCount().intValue());
        assertEquals(500L, policy.getMessageTimeoutBlocks().longValue());
        assertEquals(10L, policy.getRetryIntervalBlocks().longValue());
        assertNull(policy.getMaxGasPerMessage());
    }

    @Test
    public void processor_rows_are_cached_until_invalidated() {
        when(repository.findProcessor("eth:0xp")).thenReturn(processor(false, 3), processor(true, 3));

        assertFalse(resolver.isPaused("eth:0xp"));
        assertFalse(resolver.isPaused("eth:0xp"));
        verify(repository, times(1)).findProcessor("eth:0xp");

        resolver.invalidate("eth:0xp");
        assertTrue(resolver.isPaused("eth:0xp"));
        verify(repository, times(2)).findProcessor("eth:0xp");
    }

    @Test
    public void unknown_processor_falls_back_to_defaults_and_is_not_cached() {
        when(repository.findProcessor("eth:0xnone")).thenReturn(null);

        assertEquals(resolver.defaults().getMaxRetryCount(), resolver.policyFor("eth:0xnone").getMaxRetryCount());
        assertFalse(resolver.isPaused("eth:0xnone"));
        verify(repository, times(2)).findProcessor("eth:0xnone");
    }

    @Test
    public void returned_rows_are_copies() {
        when(repository.findProcessor("eth:0xp")).thenReturn(processor(false, 3));

        resolver.processor("eth:0xp").setPaused(true);

        assertFalse(resolver.isPaused("eth:0xp"));
    }
}
