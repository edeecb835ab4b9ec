package com.fourier.mixer.core.job;

import com.fourier.mixer.core.exception.JobException;
import com.fourier.mixer.core.mixer.MixRequest;
import com.fourier.mixer.core.mixer.MixingEngine;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 后台混合任务调度
 * <p>
 * 每个实例只有一个工作线程，同一时刻最多一个有效任务：新的 submit 会取消并取代旧任务。
 * 调用方通过轮询获取进度和结果，任务内的异常只记录日志并以进度 -1.0 体现。
 * <p>
 * 取消是协作式的：旧任务在各阶段检查自己的取消标志，已经开始的 DFT 不会被打断，
 * 但被取消的任务永远不会覆盖新任务的进度和结果。
 */
public class MixJobRunner {
    private static final Logger logger = LoggerFactory.getLogger(MixJobRunner.class);

    public static final double PROGRESS_IDLE = 0.0;
    public static final double PROGRESS_STARTED = 0.1;
    public static final double PROGRESS_DONE = 1.0;
    public static final double PROGRESS_ERROR = -1.0;

    public static final long DEFAULT_CANCEL_JOIN_MILLIS = 100;

    private final MixingEngine engine;
    private final long cancelJoinMillis;
    private final ExecutorService worker;
    private final AtomicLong jobSequence = new AtomicLong(0);

    // 以下字段都由 lock 保护
    private final Object lock = new Object();
    private MixJob currentJob;
    private Future<?> currentFuture;
    private double progress = PROGRESS_IDLE;
    private Mat result;
    private JobException lastError;

    /**
     * 单个任务的句柄
     */
    private static final class MixJob {
        private final long id;
        private final MixRequest request;
        private boolean cancelled;

        private MixJob(long id, MixRequest request) {
            this.id = id;
            this.request = request;
        }
    }

    public MixJobRunner(MixingEngine engine) {
        this(engine, DEFAULT_CANCEL_JOIN_MILLIS);
    }

    public MixJobRunner(MixingEngine engine, long cancelJoinMillis) {
        this.engine = engine;
        this.cancelJoinMillis = cancelJoinMillis;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "Mix-Worker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 取消当前任务，清空进度和结果，然后异步启动新任务
     *
     * @return 新任务编号
     */
    public long submit(MixRequest request) {
        cancelRunning();

        MixJob job = new MixJob(jobSequence.incrementAndGet(), request);
        synchronized (lock) {
            // 并发 submit 时，被替换的可能不是 cancelRunning 看到的那个任务
            if (currentJob != null) {
                currentJob.cancelled = true;
            }
            progress = PROGRESS_IDLE;
            releaseResult();
            lastError = null;
            currentJob = job;
            currentFuture = worker.submit(() -> runJob(job));
        }
        logger.info("Mixing job {} submitted: {}", job.id, request);
        return job.id;
    }

    /**
     * 设置当前任务的取消标志，并短暂等待它结束（不保证线程立即终止）
     */
    public void cancelRunning() {
        Future<?> future;
        synchronized (lock) {
            if (currentJob == null) {
                return;
            }
            currentJob.cancelled = true;
            future = currentFuture;
        }

        if (future == null || future.isDone()) {
            return;
        }
        try {
            future.get(cancelJoinMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.debug("Cancelled job still running after {} ms, continuing", cancelJoinMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            logger.warn("Cancelled job terminated abnormally", e.getCause());
        }
    }

    /**
     * 最近发布的进度；-1.0 表示出错
     */
    public double pollProgress() {
        synchronized (lock) {
            return progress;
        }
    }

    /**
     * 最近发布的结果副本，尚无结果时为 null
     */
    public Mat pollResult() {
        synchronized (lock) {
            return result == null ? null : result.clone();
        }
    }

    /**
     * 在同一把锁下读取进度、运行状态、结果和错误，保证它们属于同一个任务
     *
     * @param includeResult 为 false 时不复制结果矩阵
     */
    public MixStatus status(boolean includeResult) {
        synchronized (lock) {
            boolean running = currentFuture != null && !currentFuture.isDone();
            Mat copy = includeResult && result != null ? result.clone() : null;
            return new MixStatus(currentJob == null ? 0 : currentJob.id, progress, running, copy, lastError);
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return currentFuture != null && !currentFuture.isDone();
        }
    }

    /**
     * 最近一次失败任务的错误，成功或新提交后清空
     */
    public JobException getLastError() {
        synchronized (lock) {
            return lastError;
        }
    }

    public void shutdown() {
        cancelRunning();
        worker.shutdownNow();
        synchronized (lock) {
            releaseResult();
        }
        logger.info("Mix job runner stopped");
    }

    private void runJob(MixJob job) {
        synchronized (lock) {
            if (job.cancelled) {
                return;
            }
            progress = PROGRESS_STARTED;
        }

        try {
            long start = System.currentTimeMillis();
            Mat mixed = engine.mix(job.request);

            synchronized (lock) {
                if (job.cancelled) {
                    mixed.release();
                    logger.debug("Mixing job {} finished after being superseded, result dropped", job.id);
                    return;
                }
                releaseResult();
                result = mixed;
                progress = PROGRESS_DONE;
            }
            logger.info("Mixing job {} completed in {} ms", job.id, System.currentTimeMillis() - start);

        } catch (Exception e) {
            logger.error("Mixing job {} failed", job.id, e);
            synchronized (lock) {
                if (job.cancelled) {
                    return;
                }
                releaseResult();
                progress = PROGRESS_ERROR;
                lastError = new JobException("Mixing job " + job.id + " failed: " + e.getMessage(), e);
            }
        }
    }

    private void releaseResult() {
        if (result != null) {
            result.release();
            result = null;
        }
    }
}
