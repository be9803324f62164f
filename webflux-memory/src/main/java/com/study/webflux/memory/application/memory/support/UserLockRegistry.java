package com.study.webflux.memory.application.memory.support;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.memory.model.UserId;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

/**
 * 사용자별 비동기 상호배제 잠금입니다.
 *
 * <p>
 * 같은 사용자의 작업은 도착 순서대로 하나씩 실행되고, 다른 사용자의 작업은 서로 기다리지 않습니다. 잠금은 작업이 완료, 실패, 취소 중 어느
 * 쪽으로 끝나도 반납됩니다. 대기자가 없는 사용자의 상태는 맵에서 제거됩니다.
 */
@Slf4j
@Component
public class UserLockRegistry {

	private final Map<UserId, LockState> locks = new ConcurrentHashMap<>();

	public <T> Mono<T> withLock(UserId userId, Supplier<Mono<T>> action) {
		return Mono.usingWhen(acquire(userId), lease -> action.get(), UserLease::releaseAsync);
	}

	/** 잠금 상태를 보유 중인 사용자 수입니다. */
	public int activeUserCount() {
		return locks.size();
	}

	Mono<UserLease> acquire(UserId userId) {
		return Mono.create(sink -> {
			Waiter waiter = new Waiter(sink);
			sink.onCancel(() -> cancel(userId, waiter));

			locks.compute(userId, (key, state) -> {
				if (waiter.cancelled) {
					return state;
				}
				LockState current = state != null ? state : new LockState();
				if (current.held) {
					current.waiters.addLast(waiter);
				} else {
					current.held = true;
					waiter.lease = new UserLease(this, userId);
				}
				return current;
			});

			if (waiter.lease != null) {
				sink.success(waiter.lease);
			} else {
				log.debug("사용자 잠금 대기: user={}", userId.value());
			}
		});
	}

	private void release(UserId userId) {
		Waiter[] next = new Waiter[1];
		locks.computeIfPresent(userId, (key, state) -> {
			Waiter candidate = state.waiters.pollFirst();
			while (candidate != null && candidate.cancelled) {
				candidate = state.waiters.pollFirst();
			}
			if (candidate == null) {
				return null;
			}
			candidate.lease = new UserLease(this, userId);
			next[0] = candidate;
			return state;
		});
		if (next[0] != null) {
			next[0].sink.success(next[0].lease);
		}
	}

	private void cancel(UserId userId, Waiter waiter) {
		waiter.cancelled = true;
		UserLease[] granted = new UserLease[1];
		locks.computeIfPresent(userId, (key, state) -> {
			if (waiter.lease != null) {
				granted[0] = waiter.lease;
			} else {
				state.waiters.remove(waiter);
			}
			return state;
		});
		// 넘겨받았지만 사용되지 못한 잠금
		if (granted[0] != null) {
			granted[0].release();
		}
	}

	private static final class LockState {
		private boolean held;
		private final Deque<Waiter> waiters = new ArrayDeque<>();
	}

	private static final class Waiter {
		private final MonoSink<UserLease> sink;
		private volatile UserLease lease;
		private volatile boolean cancelled;

		private Waiter(MonoSink<UserLease> sink) {
			this.sink = sink;
		}
	}

	/** 한 번만 반납되는 잠금 보유권입니다. */
	static final class UserLease {
		private final UserLockRegistry registry;
		private final UserId userId;
		private final AtomicBoolean released = new AtomicBoolean(false);

		private UserLease(UserLockRegistry registry, UserId userId) {
			this.registry = registry;
			this.userId = userId;
		}

		void release() {
			if (released.compareAndSet(false, true)) {
				registry.release(userId);
			}
		}

		Mono<Void> releaseAsync() {
			return Mono.fromRunnable(this::release);
		}
	}
}
