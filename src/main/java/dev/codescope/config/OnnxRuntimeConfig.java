package dev.codescope.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Initialises the shared ONNX Runtime environment before the embedding and scoring models load.
 *
 * <p>The {@link OrtEnvironment} is a process-wide singleton that cannot be reconfigured once
 * created, and the bge embedding model creates it from a static initializer. Running as a {@link
 * BeanFactoryPostProcessor} applies the threading options before any model bean exists.
 *
 * <p>Query-time inference is small and latency-bound, so spinning is off and the pools stay
 * small: 2 intra-op threads, 1 inter-op thread. Concurrency comes from the search executor.
 */
@Configuration
@SuppressWarnings("NullAway")
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  static final int INTRA_OP_THREADS = 2;
  static final int INTER_OP_THREADS = 1;

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(INTRA_OP_THREADS);
      threadingOptions.setGlobalInterOpNumThreads(INTER_OP_THREADS);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "codescope", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          INTRA_OP_THREADS,
          INTER_OP_THREADS);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
