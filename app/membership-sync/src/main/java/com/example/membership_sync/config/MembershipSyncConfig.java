package com.example.membership_sync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({WebhookProperties.class, MembershipSyncProperties.class})
public class MembershipSyncConfig {}
