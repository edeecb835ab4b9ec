package com.fourier.mixer.core.job;

import com.fourier.mixer.core.exception.JobException;
import org.opencv.core.Mat;

/**
 * 某一时刻的任务状态快照，各字段来自同一个任务
 * <p>
 * result 为副本，由调用方释放
 */
public class MixStatus {
    private final long jobId;
    private final double progress;
    private final boolean running;
    private final Mat result;
    private final JobException error;

    MixStatus(long jobId, double progress, boolean running, Mat result, JobException error) {
        this.jobId = jobId;
        this.progress = progress;
        this.running = running;
        this.result = result;
        this.error = error;
    }

    public long getJobId() { return jobId; }
    public double getProgress() { return progress; }
    public boolean isRunning() { return running; }
    public Mat getResult() { return result; }
    public JobException getError() { return error; }

    public boolean isFailed() {
        return progress == MixJobRunner.PROGRESS_ERROR;
    }
}
