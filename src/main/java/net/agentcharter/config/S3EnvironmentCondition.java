/**
 * Spring {@link org.springframework.context.annotation.Condition} that enables S3 avatar storage
 * only when {@code app.avatars.s3} names a bucket and carries credentials.
 */
package net.agentcharter.config;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.util.StringUtils;

public class S3EnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(S3EnvironmentCondition.class);
    private static final AtomicBoolean messageLogged = new AtomicBoolean(false);

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        AvatarStorageProperties.S3 s3 = bindAvatarS3(context);
        boolean configured = s3.isConfigured();

        if (messageLogged.compareAndSet(false, true)) {
            if (configured) {
                logger.info("Avatar images will be stored in S3 bucket {}", s3.getBucket());
            } else {
                logger.warn("Avatar S3 settings incomplete (bucket={}, accessKeyId={}, secretAccessKey={}); using local disk",
                    status(s3.getBucket()), status(s3.getAccessKeyId()), status(s3.getSecretAccessKey()));
            }
        }
        return configured;
    }

    static AvatarStorageProperties.S3 bindAvatarS3(ConditionContext context) {
        return Binder.get(context.getEnvironment())
            .bind(AvatarStorageProperties.PREFIX + ".s3", Bindable.of(AvatarStorageProperties.S3.class))
            .orElseGet(AvatarStorageProperties.S3::new);
    }

    private static String status(String value) {
        return StringUtils.hasText(value) ? "SET" : "MISSING";
    }
}
