package com.starscape.classtag.common.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Authenticated staff member. Scopes from the JWT become granted authorities.
 */
public class UserPrincipal implements UserDetails {

    private final String userId;
    private final String email;
    private final List<String> scopes;

    public UserPrincipal(String userId, String email, List<String> scopes) {
        this.userId = userId;
        this.email = email;
        this.scopes = List.copyOf(scopes);
    }

    public String getUserId() {
        return userId;
    }

    public String getEmail() {
        return email;
    }

    public List<String> getScopes() {
        return scopes;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return scopes.stream()
                .map(SimpleGrantedAuthority::new)
                .collect(Collectors.toList());
    }

    @Override
    public String getPassword() {
        return null; // Not used with JWT
    }

    @Override
    public String getUsername() {
        return email != null ? email : userId;
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return true;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
