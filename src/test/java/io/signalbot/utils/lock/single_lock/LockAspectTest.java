package io.signalbot.utils.lock.single_lock;

import io.signalbot.configs.locks.PositionLockRegistry;
import io.signalbot.utils.LockType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LockAspect Tests")
class LockAspectTest {

    private PositionLockRegistry registry;
    private GuardedTarget proxy;

    static class GuardedTarget {
        private final PositionLockRegistry registry;

        GuardedTarget(PositionLockRegistry registry) {
            this.registry = registry;
        }

        @WithLock(registry = LockType.POSITION, keyParam = "symbol")
        public boolean heldDuringCall(String symbol) {
            return registry.getLock(symbol).isHeldByCurrentThread();
        }

        @WithLock(registry = LockType.POSITION, keyParam = "missing")
        public void wrongKey(String symbol) {
        }
    }

    @BeforeEach
    void setUp() {
        registry = new PositionLockRegistry();
        AspectJProxyFactory factory = new AspectJProxyFactory(new GuardedTarget(registry));
        factory.setProxyTargetClass(true);
        factory.addAspect(new LockAspect(registry));
        proxy = factory.getProxy();
    }

    @Test
    @DisplayName("Should hold the symbol lock during the call and release it afterwards")
    void testLockHeld() {
        assertTrue(proxy.heldDuringCall("wlfiusdt"));
        assertFalse(registry.getLock("WLFIUSDT").isLocked());
    }

    @Test
    @DisplayName("Should reject a null key")
    void testNullKey() {
        assertThrows(IllegalArgumentException.class, () -> proxy.heldDuringCall(null));
    }

    @Test
    @DisplayName("Should fail when the key parameter does not exist")
    void testUnknownKeyParam() {
        assertThrows(IllegalStateException.class, () -> proxy.wrongKey("WLFIUSDT"));
    }

    @Test
    @DisplayName("Should hand out one fair lock per symbol, case-insensitively")
    void testRegistry() {
        assertSame(registry.getLock("wlfiusdt"), registry.getLock("WLFIUSDT"));
        assertNotSame(registry.getLock("WLFIUSDT"), registry.getLock("BTCUSDT"));
        assertTrue(registry.getLock("WLFIUSDT").isFair());
    }
}
