package net.agentcharter.testutil;

import java.util.ArrayList;
import java.util.List;
import net.agentcharter.domain.artifact.ArtifactJob;
import net.agentcharter.support.queue.ArtifactJobQueue;

/**
 * Queue that records accepted jobs without running them.
 */
public class RecordingArtifactJobQueue implements ArtifactJobQueue {

    private final List<ArtifactJob> jobs = new ArrayList<>();
    private volatile boolean accepting = true;

    public void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    @Override
    public synchronized boolean enqueue(ArtifactJob job) {
        if (!accepting) {
            return false;
        }
        jobs.add(job);
        return true;
    }

    public synchronized List<ArtifactJob> jobs() {
        return List.copyOf(jobs);
    }

    public synchronized List<ArtifactJob> drain() {
        List<ArtifactJob> drained = List.copyOf(jobs);
        jobs.clear();
        return drained;
    }

    public synchronized int size() {
        return jobs.size();
    }
}
