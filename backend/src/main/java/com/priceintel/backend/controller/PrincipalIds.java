package com.priceintel.backend.controller;

import org.springframework.security.oauth2.core.user.OAuth2User;

final class PrincipalIds {

    private PrincipalIds() {
    }

    /**
     * Owner id of the logged-in user: the provider's {@code id} attribute, else the principal name.
     */
    static String ownerId(OAuth2User principal) {
        Object id = principal.getAttribute("id");
        return id != null ? id.toString() : principal.getName();
    }
}
