package com.metaget.core.parser;

import com.metaget.core.api.IMetaTagParser;
import com.metaget.core.exception.ParseFailedException;
import com.metaget.core.model.MetaTag;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * jsoup 기반 meta 추출기.
 *
 * 순회: 문서 루트부터 깊이 우선 전위(pre-order), 형제는 왼쪽→오른쪽.
 * 재귀 대신 명시적 스택을 쓰므로 중첩이 깊은 문서에서도 스택 오버플로가 없다.
 *
 * 속성 규칙(태그 단위):
 * - {@code name} 과 {@code property} 는 같은 변수에 기록 → 속성 순서상 마지막 것이 이김
 * - {@code content} 도 마지막 값이 이김
 * - 둘 중 하나라도 비어 있으면 그 태그는 건너뜀(에러 아님)
 *
 * 속성 키 대소문자/중복 처리는 jsoup 정규화를 따른다(HTML 모드: 소문자).
 * 같은 키가 한 태그에 두 번 나오면 jsoup 이 파싱 단계에서 뒤의 것을 버린다. 따라서
 * {@code <meta name="a" content="1" content="2">} 는 (a, 1) 이 된다. "마지막 값" 규칙은
 * jsoup 이 남긴 속성 목록 위에서만 적용된다.
 */
public final class JsoupMetaTagParser implements IMetaTagParser {

    private static final String META = "meta";

    @Override
    public List<MetaTag> parse(InputStream html, String baseUri) throws ParseFailedException {
        Objects.requireNonNull(html, "html");
        Document doc;
        try {
            // charsetName=null → BOM / <meta charset> 기반 판정은 jsoup 에 맡김
            doc = Jsoup.parse(html, null, baseUri == null ? "" : baseUri);
        } catch (IOException e) {
            throw new ParseFailedException(e);
        } catch (UncheckedIOException e) {
            // 토크나이저 도중 읽기 실패는 jsoup 이 unchecked 로 감싸서 던진다
            throw new ParseFailedException(e.getCause());
        }
        return walk(doc);
    }

    /** 이미 파싱된 트리를 순회. 트리는 수정하지 않는다. */
    public List<MetaTag> walk(Element root) {
        if (root == null) return List.of();

        List<MetaTag> out = new ArrayList<>();
        Deque<Element> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            Element el = stack.pop();

            if (META.equals(el.normalName())) {
                MetaTag tag = readMeta(el);
                if (tag != null) out.add(tag);
            }

            // 역순 push → 첫 자식이 먼저 pop
            for (int i = el.childrenSize() - 1; i >= 0; i--) {
                stack.push(el.child(i));
            }
        }
        return List.copyOf(out);
    }

    private static MetaTag readMeta(Element meta) {
        String name = "";
        String content = "";
        for (Attribute a : meta.attributes()) {
            switch (a.getKey()) {
                case "name", "property" -> name = a.getValue();
                case "content" -> content = a.getValue();
                default -> { }
            }
        }
        if (name.isEmpty() || content.isEmpty()) return null;
        return new MetaTag(name, content);
    }
}
