package com.whereq.easel.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.easel.client.GenerationClient;
import com.whereq.easel.config.EaselProperties;
import com.whereq.easel.exception.AssetUploadException;
import com.whereq.easel.exception.EngineExecutionException;
import com.whereq.easel.exception.GenerationTimeoutException;
import com.whereq.easel.graph.NodeGraph;
import com.whereq.easel.graph.NodeRule;
import com.whereq.easel.model.DeliveredMedia;
import com.whereq.easel.model.GenerationJob;
import com.whereq.easel.model.GenerationResult;
import com.whereq.easel.model.InputAsset;
import com.whereq.easel.model.JobStatus;
import com.whereq.easel.model.MediaArtifact;
import com.whereq.easel.model.MediaKind;
import com.whereq.easel.template.WorkflowTemplateEngine;
import com.whereq.easel.topic.TopicConfig;
import com.whereq.easel.topic.TopicRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GenerationJobProcessorTest {

    private static final String WORKFLOW = """
            {
              "3": {"class_type": "KSampler", "inputs": {"seed": 0, "positive": ["6", 0]}},
              "6": {"class_type": "CLIPTextEncode", "inputs": {"text": ""}},
              "9": {"class_type": "SaveImage", "inputs": {"images": ["3", 0]}},
              "10": {"class_type": "LoadImage", "inputs": {"image": ""}},
              "11": {"class_type": "LoadImage", "inputs": {"image": ""}}
            }
            """;

    @Mock
    private TopicRegistry topicRegistry;

    @Mock
    private GenerationClient generationClient;

    @Mock
    private DeliveryChannel delivery;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private GenerationJobProcessor processor;

    private NodeGraph workflow;

    @BeforeEach
    void setUp() throws Exception {
        workflow = new ObjectMapper().readValue(WORKFLOW, NodeGraph.class);
        processor = new GenerationJobProcessor(topicRegistry, new WorkflowTemplateEngine(), generationClient,
            delivery, new EaselProperties(), meterRegistry);
        lenient().when(delivery.updateStatus(any(), any(), anyString())).thenReturn(Mono.empty());
        lenient().when(delivery.deliver(any(), anyList(), anyString())).thenReturn(Mono.empty());
    }

    private TopicConfig topic(NodeRule... extraRules) {
        List<NodeRule> rules = new ArrayList<>();
        rules.add(NodeRule.of("prompt", List.of("6"), "text", null));
        rules.add(NodeRule.of("seed", List.of("3"), "seed", null));
        rules.addAll(List.of(extraRules));
        return TopicConfig.builder()
            .alias("portrait")
            .title("Portrait")
            .workflow(workflow)
            .rules(rules)
            .build();
    }

    private static GenerationJob job() {
        return GenerationJob.builder()
            .placeholderMessageId(100)
            .requesterId(7)
            .topicAlias("portrait")
            .prompt("a cat")
            .params(Map.of("seed", 42))
            .correlationId("abcd1234")
            .enqueuedAt(Instant.now())
            .build();
    }

    private static GenerationResult result(MediaArtifact... artifacts) {
        return GenerationResult.builder()
            .promptId("p1")
            .artifacts(List.of(artifacts))
            .queueDurationSeconds(1.0)
            .execDurationSeconds(3.0)
            .build();
    }

    private static MediaArtifact image(String filename) {
        return MediaArtifact.builder()
            .url("http://engine:8188/view?filename=" + filename + "&subfolder=&type=output")
            .filename(filename)
            .subfolder("")
            .kind(MediaKind.IMAGE)
            .mimeType("image/png")
            .build();
    }

    @Test
    void process_rendersSubmitsAndDelivers() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(topic()));
        when(generationClient.submitAndTrack(any(NodeGraph.class), any(Duration.class)))
            .thenReturn(Mono.just(result(image("out.png"))));
        when(generationClient.fetchArtifactBytes(anyString())).thenReturn(Mono.just(new byte[]{1, 2}));
        GenerationJob job = job();

        StepVerifier.create(processor.process(job)).verifyComplete();

        ArgumentCaptor<NodeGraph> graph = ArgumentCaptor.forClass(NodeGraph.class);
        verify(generationClient).submitAndTrack(graph.capture(), eq(Duration.ofSeconds(300)));
        assertEquals("a cat", graph.getValue().node("6").orElseThrow().getInputs().get("text"));
        assertEquals(42, graph.getValue().node("3").orElseThrow().getInputs().get("seed"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DeliveredMedia>> media = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<String> caption = ArgumentCaptor.forClass(String.class);
        verify(delivery).deliver(eq(job), media.capture(), caption.capture());
        assertEquals(1, media.getValue().size());
        assertEquals(2, media.getValue().get(0).getContent().length);
        assertTrue(caption.getValue().startsWith("a cat\n\nQueue: "));
        verify(delivery, never()).updateStatus(any(), any(), anyString());
        assertEquals(1.0, meterRegistry.get("easel.jobs.succeeded").counter().count());
    }

    @Test
    void process_queuedJob_switchesToRunningFirst() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(topic()));
        when(generationClient.submitAndTrack(any(NodeGraph.class), any(Duration.class)))
            .thenReturn(Mono.just(result(image("out.png"))));
        when(generationClient.fetchArtifactBytes(anyString())).thenReturn(Mono.just(new byte[]{1}));
        GenerationJob job = job();
        job.setInitiallyQueued(true);

        StepVerifier.create(processor.process(job)).verifyComplete();

        InOrder order = inOrder(delivery, generationClient);
        order.verify(delivery).updateStatus(job, JobStatus.RUNNING, StatusMessages.GENERATING);
        order.verify(generationClient).submitAndTrack(any(NodeGraph.class), any(Duration.class));
        order.verify(delivery).deliver(eq(job), anyList(), anyString());
    }

    @Test
    void process_engineError_reportsEngineMessage() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(topic()));
        when(generationClient.submitAndTrack(any(NodeGraph.class), any(Duration.class)))
            .thenReturn(Mono.error(new EngineExecutionException("OOM")));
        GenerationJob job = job();

        StepVerifier.create(processor.process(job)).verifyComplete();

        verify(delivery).updateStatus(job, JobStatus.FAILED, "Engine error: OOM");
        verify(delivery, never()).deliver(any(), anyList(), anyString());
        assertEquals(1.0, meterRegistry.get("easel.jobs.failed").counter().count());
    }

    @Test
    void process_timeout_reportsTimeout() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(topic()));
        when(generationClient.submitAndTrack(any(NodeGraph.class), any(Duration.class)))
            .thenReturn(Mono.error(new GenerationTimeoutException("too slow")));
        GenerationJob job = job();

        StepVerifier.create(processor.process(job)).verifyComplete();

        verify(delivery).updateStatus(job, JobStatus.TIMEOUT, StatusMessages.GENERATION_TIMEOUT);
        assertEquals(1.0, meterRegistry.get("easel.jobs.timeout").counter().count());
    }

    @Test
    void process_unexpectedError_reportsGenericFailure() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(topic()));
        when(generationClient.submitAndTrack(any(NodeGraph.class), any(Duration.class)))
            .thenReturn(Mono.error(new IllegalStateException("connection reset")));
        GenerationJob job = job();

        StepVerifier.create(processor.process(job)).verifyComplete();

        verify(delivery).updateStatus(job, JobStatus.FAILED, StatusMessages.GENERATION_FAILED);
    }

    @Test
    void process_noArtifacts_reportsNoMedia() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(topic()));
        when(generationClient.submitAndTrack(any(NodeGraph.class), any(Duration.class)))
            .thenReturn(Mono.just(result()));
        GenerationJob job = job();

        StepVerifier.create(processor.process(job)).verifyComplete();

        verify(delivery).updateStatus(job, JobStatus.FAILED, StatusMessages.NO_MEDIA);
        verify(generationClient, never()).fetchArtifactBytes(anyString());
    }

    @Test
    void process_unknownTopic_reportsFailure() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.empty());
        GenerationJob job = job();

        StepVerifier.create(processor.process(job)).verifyComplete();

        verify(delivery).updateStatus(job, JobStatus.FAILED, StatusMessages.TOPIC_NOT_FOUND);
        verifyNoInteractions(generationClient);
    }

    @Test
    void process_imageTopicWithoutImage_reportsFailure() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(
            topic(NodeRule.of("input_images", List.of("10", "11"), "image", null))));
        GenerationJob job = job();

        StepVerifier.create(processor.process(job)).verifyComplete();

        verify(delivery).updateStatus(job, JobStatus.FAILED, StatusMessages.REQUIRES_INPUT_IMAGE);
        verifyNoInteractions(generationClient);
    }

    @Test
    void process_uploadsImagesInOrderAndPrunesUnused() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(
            topic(NodeRule.of("input_images", List.of("10", "11"), "image", null))));
        when(generationClient.uploadInputAsset(any(byte[].class), eq("first.png"))).thenReturn(Mono.just("first (1).png"));
        when(generationClient.submitAndTrack(any(NodeGraph.class), any(Duration.class)))
            .thenReturn(Mono.just(result(image("out.png"))));
        when(generationClient.fetchArtifactBytes(anyString())).thenReturn(Mono.just(new byte[]{1}));
        GenerationJob job = job();
        job.setInputImages(List.of(new InputAsset("first.png", new byte[]{9})));

        StepVerifier.create(processor.process(job)).verifyComplete();

        ArgumentCaptor<NodeGraph> graph = ArgumentCaptor.forClass(NodeGraph.class);
        verify(generationClient).submitAndTrack(graph.capture(), any(Duration.class));
        assertEquals("first (1).png", graph.getValue().node("10").orElseThrow().getInputs().get("image"));
        assertTrue(graph.getValue().node("11").isEmpty());
    }

    @Test
    void process_unnamedUpload_getsGeneratedName() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(
            topic(NodeRule.of("input_image", List.of("10"), "image", null))));
        when(generationClient.uploadInputAsset(any(byte[].class), eq("upload_abcd1234.png")))
            .thenReturn(Mono.just("upload_abcd1234.png"));
        when(generationClient.submitAndTrack(any(NodeGraph.class), any(Duration.class)))
            .thenReturn(Mono.just(result(image("out.png"))));
        when(generationClient.fetchArtifactBytes(anyString())).thenReturn(Mono.just(new byte[]{1}));
        GenerationJob job = job();
        job.setInputImage(new InputAsset(null, new byte[]{9}));

        StepVerifier.create(processor.process(job)).verifyComplete();

        ArgumentCaptor<NodeGraph> graph = ArgumentCaptor.forClass(NodeGraph.class);
        verify(generationClient).submitAndTrack(graph.capture(), any(Duration.class));
        assertEquals("upload_abcd1234.png", graph.getValue().node("10").orElseThrow().getInputs().get("image"));
    }

    @Test
    void process_uploadFailure_reportsFailureWithoutSubmitting() {
        when(topicRegistry.find("portrait")).thenReturn(Optional.of(
            topic(NodeRule.of("input_images", List.of("10", "11"), "image", null))));
        when(generationClient.uploadInputAsset(any(byte[].class), anyString()))
            .thenReturn(Mono.error(new AssetUploadException("HTTP 500")));
        GenerationJob job = job();
        job.setInputImages(List.of(new InputAsset("first.png", new byte[]{9})));

        StepVerifier.create(processor.process(job)).verifyComplete();

        verify(delivery).updateStatus(job, JobStatus.FAILED, StatusMessages.UPLOAD_FAILED);
        verify(generationClient, never()).submitAndTrack(any(NodeGraph.class), any(Duration.class));
    }

    @Test
    void process_canceledJob_doesNothing() {
        GenerationJob job = job();
        job.setCanceled(true);

        StepVerifier.create(processor.process(job)).verifyComplete();

        verifyNoInteractions(topicRegistry, generationClient, delivery);
    }
}
