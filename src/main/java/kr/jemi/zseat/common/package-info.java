@ApplicationModule(type = ApplicationModule.Type.OPEN)
package kr.jemi.zseat.common;

import org.springframework.modulith.ApplicationModule;
