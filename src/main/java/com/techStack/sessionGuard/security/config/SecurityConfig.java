package com.techStack.sessionGuard.security.config;

import com.techStack.sessionGuard.models.session.SecurityLevel;
import com.techStack.sessionGuard.security.authentication.SessionAuthenticationToken;
import com.techStack.sessionGuard.security.authentication.SessionSecurityContextRepository;
import com.techStack.sessionGuard.security.authentication.TrustedCallerAuthenticationToken;
import com.techStack.sessionGuard.security.authorization.SecurityLevelAccessDeniedHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.server.SecurityWebFilterChain;

@Configuration
@EnableWebFluxSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final SessionSecurityContextRepository securityContextRepository;
    private final SessionAuthenticationEntryPoint authenticationEntryPoint;
    private final SecurityLevelAccessDeniedHandler accessDeniedHandler;

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http) {
        String highLevel = SessionAuthenticationToken.authority(SecurityLevel.HIGH);
        String anySession = SessionAuthenticationToken.authority(SecurityLevel.LOW);

        return http
                .csrf(ServerHttpSecurity.CsrfSpec::disable)
                .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
                .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
                .logout(ServerHttpSecurity.LogoutSpec::disable)
                .requestCache(ServerHttpSecurity.RequestCacheSpec::disable)
                .authorizeExchange(exchange -> exchange
                        .pathMatchers(
                                "/api/auth/login",
                                "/api/auth/remember-me",
                                "/api/sessions/status",
                                "/actuator/health"
                        ).permitAll()
                        .pathMatchers(HttpMethod.POST, "/api/sessions")
                        .hasAuthority(TrustedCallerAuthenticationToken.TRUSTED_CALLER)
                        .pathMatchers(
                                "/api/auth/login-stats",
                                "/api/sessions/stats",
                                "/api/sessions/cleanup"
                        ).hasAuthority(highLevel)
                        .anyExchange().hasAuthority(anySession)
                )
                .exceptionHandling(handling -> handling
                        .authenticationEntryPoint(authenticationEntryPoint)
                        .accessDeniedHandler(accessDeniedHandler)
                )
                .securityContextRepository(securityContextRepository)
                .build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
