package com.explify.sidecar.config;

import static org.junit.jupiter.api.Assertions.*;

import com.explify.sidecar.model.OperatingMode;
import org.junit.jupiter.api.Test;

class ModeConfigTest {

    @Test
    void onlyExplicitTrueSelectsNetworkedMode() {
        assertEquals(OperatingMode.NETWORKED, OperatingMode.fromRequireAuth("true"));
        assertEquals(OperatingMode.NETWORKED, OperatingMode.fromRequireAuth(" TRUE "));
        assertEquals(OperatingMode.LOCAL, OperatingMode.fromRequireAuth("false"));
        assertEquals(OperatingMode.LOCAL, OperatingMode.fromRequireAuth("1"));
        assertEquals(OperatingMode.LOCAL, OperatingMode.fromRequireAuth(""));
        assertEquals(OperatingMode.LOCAL, OperatingMode.fromRequireAuth(null));
    }

    @Test
    void exposesModePredicates() {
        assertTrue(ModeConfig.networked().isNetworked());
        assertFalse(ModeConfig.networked().isLocal());
        assertTrue(ModeConfig.local().isLocal());
        assertEquals(OperatingMode.LOCAL, ModeConfig.of(OperatingMode.LOCAL).getMode());
    }

    @Test
    void derivesCognitoIssuer() {
        assertEquals("https://cognito-idp.eu-west-1.amazonaws.com/eu-west-1_abc",
                IdentityConfiguration.resolveIssuer("", "eu-west-1", "eu-west-1_abc"));
        assertEquals("https://issuer.example", IdentityConfiguration.resolveIssuer("https://issuer.example", "eu-west-1", "pool"));
        assertEquals("", IdentityConfiguration.resolveIssuer("", "eu-west-1", ""));
    }
}
