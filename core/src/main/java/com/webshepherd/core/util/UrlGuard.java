package com.webshepherd.core.util;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 스캔 요청 URL 검증(공개 대상만 허용).
 * - http/https 만, host 필수
 * - localhost/루프백, 사설 IPv4(10/8, 172.16/12, 192.168/16), 링크로컬(169.254/16) 거부
 * - IPv6 리터럴: 루프백, 미지정(::), 고유 로컬(fc00::/7), 링크로컬(fe80::/10), IPv4 매핑 주소
 * DNS 조회는 하지 않는다: 리터럴 호스트만 판정.
 */
public final class UrlGuard {
    private UrlGuard() {}

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");

    /**
     * @return 파싱된 URI
     * @throws IllegalArgumentException 거부 사유 포함
     */
    public static URI requirePublic(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("URL must not be blank");
        URI u;
        try {
            u = new URI(raw.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + raw, e);
        }
        String scheme = u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("URL must use http or https");
        }
        String host = u.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("URL must include a host");
        }
        if (isLocalOrPrivate(host)) {
            throw new IllegalArgumentException("Cannot scan localhost or private IP addresses");
        }
        return u;
    }

    public static boolean isPublic(String raw) {
        try {
            requirePublic(raw);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static boolean isLocalOrPrivate(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) h = h.substring(1, h.length() - 1);
        if (h.equals("localhost") || h.endsWith(".localhost")) return true;
        if (h.indexOf(':') >= 0) return isLocalOrPrivateV6(h);

        Matcher m = IPV4.matcher(h);
        if (!m.matches()) return false;
        int a = Integer.parseInt(m.group(1));
        int b = Integer.parseInt(m.group(2));
        return a == 127
                || a == 0
                || a == 10
                || (a == 172 && b >= 16 && b <= 31)
                || (a == 192 && b == 168)
                || (a == 169 && b == 254);
    }

    /** IPv6 리터럴 판정. 콜론이 있는 문자열은 리터럴로만 해석되므로 DNS 조회가 일어나지 않는다. */
    private static boolean isLocalOrPrivateV6(String literal) {
        InetAddress addr;
        try {
            addr = InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            return true; // 해석 불가한 리터럴은 거부
        }
        if (addr instanceof Inet4Address) {
            // ::ffff:a.b.c.d 는 JDK 가 IPv4 주소로 돌려준다
            return isLocalOrPrivate(addr.getHostAddress());
        }
        byte[] b = addr.getAddress();
        return addr.isLoopbackAddress()
                || addr.isAnyLocalAddress()
                || addr.isLinkLocalAddress()
                || (b[0] & 0xfe) == 0xfc;
    }
}
