package com.metaget.core.api;

import com.metaget.core.exception.MetaExtractionException;
import com.metaget.core.model.MetaTag;

import java.io.InputStream;
import java.util.List;

/** meta 추출 최소 계약: URL(또는 이미 받은 본문)을 받아 태그 목록을 돌려준다. */
public interface IMetaExtractor {
    List<MetaTag> extract(String url) throws MetaExtractionException;

    List<MetaTag> extract(InputStream html) throws MetaExtractionException;
}
