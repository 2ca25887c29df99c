package com.prediction.market.settlement_engine.security;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.settlement_engine.error.SettlementError;
import com.prediction.market.settlement_engine.error.SettlementException;
import com.prediction.market.settlement_engine.execution.InvocationContext;
import com.prediction.market.settlement_engine.support.ContractFixture;

import static org.junit.jupiter.api.Assertions.*;

class AccessControllerTest {

    private final ContractFixture fixture = new ContractFixture();
    private final AccessController access = fixture.accessController;

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void initialize_shouldStorePrincipalsOnce() {
        access.initialize(fixture.ctx("admin"), "admin", "oracle");

        assertEquals("admin", access.admin(fixture.ctx()).orElseThrow());
        assertEquals("oracle", access.oracle(fixture.ctx()).orElseThrow());

        SettlementException e = assertThrows(SettlementException.class,
                () -> access.initialize(fixture.ctx("intruder"), "intruder", "intruder"));
        assertEquals(SettlementError.ALREADY_INITIALIZED, e.getError());
        assertEquals("admin", access.admin(fixture.ctx()).orElseThrow());
    }

    @Test
    void initialize_shouldRequireAdminSignature() {
        SettlementException e = assertThrows(SettlementException.class,
                () -> access.initialize(fixture.ctx("someone"), "admin", "oracle"));
        assertEquals(SettlementError.UNAUTHORIZED_ADMIN, e.getError());
        assertTrue(access.admin(fixture.ctx()).isEmpty());
    }

    @Test
    void require_shouldReportUnsetPrincipals() {
        InvocationContext ctx = fixture.ctx("admin");

        assertEquals(SettlementError.ADMIN_NOT_SET,
                assertThrows(SettlementException.class, () -> access.requireAdmin(ctx)).getError());
        assertEquals(SettlementError.ORACLE_NOT_SET,
                assertThrows(SettlementException.class, () -> access.requireOracle(ctx)).getError());
    }

    @Test
    void require_shouldRejectWrongCaller() {
        access.initialize(fixture.ctx("admin"), "admin", "oracle");

        assertEquals(SettlementError.UNAUTHORIZED_ADMIN,
                assertThrows(SettlementException.class, () -> access.requireAdmin(fixture.ctx("oracle"))).getError());
        assertEquals(SettlementError.UNAUTHORIZED_ORACLE,
                assertThrows(SettlementException.class, () -> access.requireOracle(fixture.ctx("admin"))).getError());
        assertEquals("admin", access.requireAdmin(fixture.ctx("admin")));
        assertEquals("oracle", access.requireOracle(fixture.ctx("oracle")));
    }

    @Test
    void requireUser_shouldNotAllowActingForSomeoneElse() {
        SettlementException e = assertThrows(SettlementException.class,
                () -> access.requireUser(fixture.ctx("bob"), "alice"));
        assertEquals(SettlementError.UNAUTHORIZED_USER, e.getError());
        assertDoesNotThrow(() -> access.requireUser(fixture.ctx("bob", "alice"), "alice"));
    }

    @Test
    void initialize_shouldRejectBlankPrincipals() {
        assertEquals(SettlementError.UNAUTHORIZED_ADMIN, assertThrows(SettlementException.class,
                () -> access.initialize(fixture.ctx("admin"), "", "oracle")).getError());
        assertEquals(SettlementError.UNAUTHORIZED_ADMIN, assertThrows(SettlementException.class,
                () -> access.initialize(fixture.ctx("admin"), null, "oracle")).getError());
        assertEquals(SettlementError.ORACLE_NOT_SET, assertThrows(SettlementException.class,
                () -> access.initialize(fixture.ctx("admin"), "admin", "")).getError());
        assertEquals(SettlementError.ORACLE_NOT_SET, assertThrows(SettlementException.class,
                () -> access.initialize(fixture.ctx("admin"), "admin", null)).getError());

        assertTrue(access.admin(fixture.ctx()).isEmpty());
        assertTrue(access.oracle(fixture.ctx()).isEmpty());
    }

    @Test
    void requireUser_shouldRejectBlankUser() {
        assertEquals(SettlementError.UNAUTHORIZED_USER,
                assertThrows(SettlementException.class, () -> access.requireUser(fixture.ctx("bob"), "")).getError());
        assertEquals(SettlementError.UNAUTHORIZED_USER,
                assertThrows(SettlementException.class, () -> access.requireUser(fixture.ctx("bob"), null)).getError());
    }

    @Test
    void isAuthorized_shouldCheckPrincipalSet() {
        assertTrue(access.isAuthorized("a", CallAuthorization.of("a", "b")));
        assertFalse(access.isAuthorized("c", CallAuthorization.of("a", "b")));
        assertFalse(access.isAuthorized("a", CallAuthorization.none()));
    }
}
