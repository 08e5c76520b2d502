@NamedInterface("api")
package kr.jemi.zseat.catalog.api;

import org.springframework.modulith.NamedInterface;
