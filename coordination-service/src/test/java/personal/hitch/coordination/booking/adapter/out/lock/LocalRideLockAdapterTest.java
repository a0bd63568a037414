package personal.hitch.coordination.booking.adapter.out.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LocalRideLockAdapter 단위 테스트")
class LocalRideLockAdapterTest {

    @Test
    @DisplayName("같은 운행의 락은 다른 스레드가 대기 시간 안에 얻지 못한다")
    void tryLock_SameRideBlocksOtherThread() throws Exception {
        // given
        LocalRideLockAdapter adapter = new LocalRideLockAdapter(16, 50);
        assertThat(adapter.tryLock(1L, "owner-a")).isTrue();

        // when
        boolean acquiredByOther = CompletableFuture.supplyAsync(() -> adapter.tryLock(1L, "owner-b"))
                .get(5, TimeUnit.SECONDS);

        // then
        assertThat(acquiredByOther).isFalse();
        adapter.unlock(1L, "owner-a");
    }

    @Test
    @DisplayName("해제된 락은 다른 스레드가 얻을 수 있다")
    void unlock_AllowsNextOwner() throws Exception {
        // given
        LocalRideLockAdapter adapter = new LocalRideLockAdapter(16, 50);
        adapter.tryLock(1L, "owner-a");
        adapter.unlock(1L, "owner-a");

        // when
        boolean acquiredByOther = CompletableFuture.supplyAsync(() -> {
            boolean locked = adapter.tryLock(1L, "owner-b");
            adapter.unlock(1L, "owner-b");
            return locked;
        }).get(5, TimeUnit.SECONDS);

        // then
        assertThat(acquiredByOther).isTrue();
    }

    @Test
    @DisplayName("다른 stripe에 속한 운행은 서로를 막지 않는다")
    void tryLock_DifferentStripes() throws Exception {
        // given
        LocalRideLockAdapter adapter = new LocalRideLockAdapter(16, 50);
        adapter.tryLock(1L, "owner-a");

        // when
        boolean acquiredOtherRide = CompletableFuture.supplyAsync(() -> {
            boolean locked = adapter.tryLock(2L, "owner-b");
            adapter.unlock(2L, "owner-b");
            return locked;
        }).get(5, TimeUnit.SECONDS);

        // then
        assertThat(acquiredOtherRide).isTrue();
        adapter.unlock(1L, "owner-a");
    }

    @Test
    @DisplayName("stripe 수는 양수여야 한다")
    void constructor_InvalidStripeCount() {
        assertThatThrownBy(() -> new LocalRideLockAdapter(0, 50))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
