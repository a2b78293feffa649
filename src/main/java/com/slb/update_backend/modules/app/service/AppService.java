package com.slb.update_backend.modules.app.service;

import com.slb.update_backend.common.exception.BizException;
import com.slb.update_backend.common.vo.PageVo;
import com.slb.update_backend.modules.app.dto.AppCreateDto;
import com.slb.update_backend.modules.app.dto.AppUpdateDto;
import com.slb.update_backend.modules.app.entity.App;
import com.slb.update_backend.modules.app.mapper.AppMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Service
@Slf4j
public class AppService {

    private static final Pattern SLUG = Pattern.compile("^[a-z][a-z0-9-]*[a-z0-9]$");

    private final AppMapper appMapper;
    private final Clock clock;

    public AppService(AppMapper appMapper, Clock clock) {
        this.appMapper = appMapper;
        this.clock = clock;
    }

    public App create(AppCreateDto dto) {
        String slug = dto.getSlug() == null ? "" : dto.getSlug().trim().toLowerCase(Locale.ROOT);
        validateSlug(slug);
        if (appMapper.findBySlug(slug).isPresent()) {
            throw BizException.conflict("App slug '" + slug + "' is already taken");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        App app = new App();
        app.setSlug(slug);
        app.setName(dto.getName().trim());
        app.setDescription(StringUtils.hasText(dto.getDescription()) ? dto.getDescription().trim() : null);
        app.setPublicKey(StringUtils.hasText(dto.getPublicKey()) ? dto.getPublicKey().trim() : null);
        app.setCreatedAt(now);
        app.setUpdatedAt(now);
        try {
            appMapper.insert(app);
        } catch (DuplicateKeyException e) {
            // 并发创建同一 slug：以唯一键为准
            throw BizException.conflict("App slug '" + slug + "' is already taken");
        }
        log.info("App created: id={}, slug={}", app.getId(), slug);
        return app;
    }

    public App get(Long id) {
        return appMapper.selectById(id).orElseThrow(() -> BizException.notFound("App", id));
    }

    public App getBySlug(String slug) {
        return appMapper.findBySlug(slug).orElseThrow(() -> BizException.notFound("App", slug));
    }

    public PageVo<App> list(int page, int size) {
        int p = Math.max(page, 1);
        int s = Math.min(Math.max(size, 1), 100);
        List<App> apps = appMapper.selectPage(PageVo.offset(p, s), s);
        return new PageVo<>(appMapper.countAll(), p, s, apps);
    }

    public App update(Long id, AppUpdateDto dto) {
        App app = get(id);
        if (dto.getName() != null) {
            app.setName(dto.getName().trim());
        }
        if (dto.getDescription() != null) {
            app.setDescription(StringUtils.hasText(dto.getDescription()) ? dto.getDescription().trim() : null);
        }
        if (dto.getPublicKey() != null) {
            app.setPublicKey(StringUtils.hasText(dto.getPublicKey()) ? dto.getPublicKey().trim() : null);
        }
        app.setUpdatedAt(LocalDateTime.now(clock));
        appMapper.update(app);
        return app;
    }

    /**
     * 有已发布版本的应用不可删除：客户端仍可能在检查更新。
     */
    public void delete(Long id) {
        App app = get(id);
        long published = appMapper.countPublishedReleases(app.getId());
        if (published > 0) {
            throw BizException.conflict("App '" + app.getSlug() + "' has " + published
                    + " published release(s); archive them before deleting the app");
        }
        appMapper.deleteById(app.getId());
        log.info("App deleted: id={}, slug={}", app.getId(), app.getSlug());
    }

    private void validateSlug(String slug) {
        if (slug.length() < 2 || slug.length() > 50) {
            throw new BizException(400, "slug 长度需在 2-50 之间");
        }
        if (!SLUG.matcher(slug).matches() || slug.contains("--")) {
            throw new BizException(400, "slug 只能包含小写字母、数字和单个连字符，且以字母开头、字母或数字结尾");
        }
    }
}
