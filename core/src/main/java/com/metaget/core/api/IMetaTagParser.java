package com.metaget.core.api;

import com.metaget.core.exception.ParseFailedException;
import com.metaget.core.model.MetaTag;

import java.io.InputStream;
import java.util.List;

/** HTML 바이트 스트림 → meta 태그 목록(문서 순서). */
public interface IMetaTagParser {
    List<MetaTag> parse(InputStream html, String baseUri) throws ParseFailedException;
}
