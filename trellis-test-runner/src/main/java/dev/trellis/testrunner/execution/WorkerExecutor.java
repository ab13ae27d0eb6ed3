package dev.trellis.testrunner.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs each submitted task on its own named platform thread.
 * Tasks report their own failures; {@link #join()} waits for every thread still running.
 */
final class WorkerExecutor {

	WorkerExecutor(String threadNamePrefix) {
		this.threadNamePrefix = threadNamePrefix;
	}

	private final String threadNamePrefix;
	private final ReentrantLock lock = new ReentrantLock();
	private final List<Thread> threads = new ArrayList<>();
	private int nextThreadId = 0;

	void submit(Runnable command) {
		lock.lock();
		try {
			var thread = new Thread(() -> {
				try {
					command.run();
				}
				finally {
					lock.lock();
					try {
						threads.remove(Thread.currentThread());
					}
					finally {
						lock.unlock();
					}
				}
			}, threadNamePrefix + "-" + nextThreadId++);
			threads.add(thread);
			thread.start();
		}
		finally {
			lock.unlock();
		}
	}

	void join() throws InterruptedException {
		List<Thread> running;
		lock.lock();
		try {
			running = new ArrayList<>(threads);
		}
		finally {
			lock.unlock();
		}

		for(var thread : running) {
			thread.join();
		}
	}
}
